package com.pipewright.core.config;

/**
 * Fatal problem with the pipeline definition or run options, such as a dependency
 * cycle or an unknown task name. Always raised before any task starts.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
