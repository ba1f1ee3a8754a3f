package com.deepansh.chatagent.exception;

/**
 * A send / edit / delete against the chat platform failed.
 */
public class ChatGatewayException extends AgentException {

    public ChatGatewayException(String message) {
        super(message);
    }

    public ChatGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
