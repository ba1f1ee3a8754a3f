package com.deepansh.chatagent.exception;

/**
 * The reasoning service could not produce a usable decision: transport failure,
 * timeout, or a response carrying neither a tool call nor content.
 * Always fatal for the session.
 */
public class ReasoningException extends AgentException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
