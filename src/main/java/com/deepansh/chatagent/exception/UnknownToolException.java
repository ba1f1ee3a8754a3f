package com.deepansh.chatagent.exception;

import lombok.Getter;

@Getter
public class UnknownToolException extends AgentException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Reasoning service proposed unregistered tool '" + toolName + "'");
        this.toolName = toolName;
    }
}
