package com.deepansh.chatagent.observability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-session observability data: reasoning calls, token usage, and the
 * tool call sequence. Flushed to an AgentRunTrace when the session ends.
 *
 * Kept apart from the session's conversation state so tracing concerns
 * don't bleed into the loop. Only the session's own thread writes to it.
 */
@Getter
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int reasoningCalls;
    private int promptTokens;
    private int completionTokens;

    public void recordReasoningCall(int prompt, int completion) {
        this.reasoningCalls++;
        this.promptTokens += prompt;
        this.completionTokens += completion;
    }

    public void recordToolCall(String toolName, long latencyMs, boolean success, String output) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, success, preview(output)));
    }

    public List<ToolCallRecord> toolCalls() {
        return Collections.unmodifiableList(toolCallRecords);
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    private static String preview(String s) {
        if (s == null) return null;
        return s.length() <= 200 ? s : s.substring(0, 200) + "...[truncated]";
    }

    public record ToolCallRecord(
            String toolName,
            long latencyMs,
            boolean success,
            String outputPreview
    ) {}
}
