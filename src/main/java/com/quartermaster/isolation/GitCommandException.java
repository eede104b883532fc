package com.quartermaster.isolation;

/**
 * Thrown when the {@code git} binary cannot be started or the calling thread is interrupted
 * while waiting for it. A git command that runs and exits non-zero is not an exception.
 */
public class GitCommandException extends RuntimeException {

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
