package com.quartermaster.agent;

/**
 * Thrown when an agent subprocess cannot be started.
 */
public class ProcessLaunchException extends RuntimeException {

    public ProcessLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
