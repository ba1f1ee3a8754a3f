package com.deepansh.chatagent.tool;

/**
 * Registry entry: the executor plus its dispatch metadata.
 *
 * @param tool     executor
 * @param quota    per-session limit, null when unlimited
 * @param terminal whether success ends the session
 */
public record RegisteredTool(AgentTool tool, Integer quota, boolean terminal) {

    public String name() {
        return tool.getName();
    }

    public boolean hasQuota() {
        return quota != null;
    }
}
