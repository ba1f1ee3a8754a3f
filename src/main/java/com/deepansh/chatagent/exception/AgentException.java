package com.deepansh.chatagent.exception;

/**
 * Base unchecked exception for agent failures.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
