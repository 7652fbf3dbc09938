package com.pipewright.core.state;

/**
 * Whether a task has to run again, and why.
 */
public record RegenerationDecision(boolean regenerate, String reason) {

    public static final String UP_TO_DATE = "up-to-date";

    public static RegenerationDecision regenerate(String reason) {
        return new RegenerationDecision(true, reason);
    }

    public static RegenerationDecision upToDate() {
        return new RegenerationDecision(false, UP_TO_DATE);
    }
}
