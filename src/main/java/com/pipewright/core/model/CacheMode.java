package com.pipewright.core.model;

import com.pipewright.core.config.ConfigurationException;

import java.util.Locale;

/**
 * How a run treats output recorded by previous runs.
 * <p>
 * NORMAL: regenerate every task, recording fresh hashes.
 * RESUME: skip tasks whose recorded output is still valid.
 * FORCE: discard all recorded state first, then regenerate every task.
 */
public enum CacheMode {
    NORMAL,
    RESUME,
    FORCE;

    public static CacheMode parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cache mode: " + value
                    + " (valid: normal, resume, force)");
        }
    }
}
