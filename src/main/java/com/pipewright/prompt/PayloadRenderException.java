package com.pipewright.prompt;

/**
 * A task payload could not be produced, e.g. a configured prompt file is unreadable.
 */
public class PayloadRenderException extends Exception {

    public PayloadRenderException(String message) {
        super(message);
    }

    public PayloadRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
