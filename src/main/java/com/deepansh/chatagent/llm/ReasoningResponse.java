package com.deepansh.chatagent.llm;

import com.deepansh.chatagent.model.ToolInvocation;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ReasoningResponse {

    /** Non-blank when the service produced a final text answer */
    private String content;

    /** Every tool call the service proposed this turn, in proposal order */
    @Builder.Default
    private List<ToolInvocation> toolCalls = List.of();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasToolCall() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }

    public ToolInvocation firstToolCall() {
        return toolCalls.get(0);
    }

    public static ReasoningResponse content(String text) {
        return ReasoningResponse.builder().content(text).build();
    }

    public static ReasoningResponse toolCall(ToolInvocation call) {
        return ReasoningResponse.builder().toolCalls(List.of(call)).build();
    }
}
