package com.deepansh.chatagent.llm;

import com.deepansh.chatagent.model.Message;
import com.deepansh.chatagent.tool.ToolDefinition;

import java.util.List;

/**
 * @param messages ordered turns, system prompt first
 * @param tools    schemas the service may choose from; empty forces a text answer
 */
public record ReasoningRequest(List<Message> messages, List<ToolDefinition> tools) {

    public ReasoningRequest {
        messages = List.copyOf(messages);
        tools = List.copyOf(tools);
    }
}
