package com.deepansh.chatagent.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What the reasoning service is told about one tool: its name, the
 * description it chooses by, and the argument schema.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    static ToolDefinition of(RegisteredTool entry) {
        AgentTool tool = entry.tool();
        return new ToolDefinition(tool.getName(), tool.getDescription().strip(), tool.getInputSchema());
    }

    /** First line of the description, for compact tool listings */
    public String summary() {
        if (description == null) return "";
        int nl = description.indexOf('\n');
        return nl < 0 ? description : description.substring(0, nl);
    }

    /** Chat-completions "function" tool entry */
    public Map<String, Object> toFunctionSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description != null ? description : "",
                        "parameters", inputSchema != null ? inputSchema : Map.of("type", "object")
                )
        );
    }
}
