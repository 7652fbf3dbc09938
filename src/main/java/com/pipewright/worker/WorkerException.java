package com.pipewright.worker;

/**
 * A worker could not be started or did not answer a request.
 */
public class WorkerException extends Exception {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
