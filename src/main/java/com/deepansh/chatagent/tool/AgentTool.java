package com.deepansh.chatagent.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the reasoning service so it knows how to invoke the tool.
 *
 * Unlike the status and delivery paths, tools report failure by throwing:
 * the orchestrator turns the exception into a "&lt;name&gt; failed: ..." line in
 * the session context and keeps going.
 */
public interface AgentTool {

    /** Unique snake_case name the reasoning service uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the reasoning
     * service uses to decide when to call this tool.
     */
    String getDescription();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters.
     */
    Map<String, Object> getInputSchema();

    /**
     * Default per-session invocation limit; null means unlimited.
     * {@code agent.tool-quotas.<name>} overrides it.
     */
    default Integer getDefaultQuota() {
        return null;
    }

    /**
     * A terminal tool delivers the final answer itself; its successful
     * execution ends the session.
     */
    default boolean isTerminal() {
        return false;
    }

    ToolResult execute(Map<String, Object> arguments, String chatId) throws Exception;
}
