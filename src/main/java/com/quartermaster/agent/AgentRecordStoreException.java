package com.quartermaster.agent;

/**
 * Thrown when an agent record cannot be read, parsed or written.
 */
public class AgentRecordStoreException extends RuntimeException {

    public AgentRecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
