package com.quartermaster.core.repository;

/**
 * Thrown when the backlog file cannot be read or written.
 */
public class ArtefactStoreException extends RuntimeException {

    public ArtefactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
