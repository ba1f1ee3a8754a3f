package com.deepansh.chatagent.tool;

import com.deepansh.chatagent.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Central registry for all AgentTool implementations.
 *
 * Spring injects every AgentTool bean; they are indexed by name once at
 * startup and the map is read-only afterwards, so concurrent sessions can
 * share it without locking.
 *
 * Quotas come from {@code agent.tool-quotas} when configured, otherwise from
 * the tool's own default. A configured value below zero means unlimited.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, RegisteredTool> tools;
    private final List<ToolDefinition> definitions;

    public ToolRegistry(List<AgentTool> toolBeans, AgentProperties properties) {
        Map<String, RegisteredTool> index = new LinkedHashMap<>();
        Map<String, Integer> configured = properties.getToolQuotas();

        toolBeans.forEach(tool -> {
            Integer quota = configured.containsKey(tool.getName())
                    ? normalize(configured.get(tool.getName()))
                    : tool.getDefaultQuota();
            RegisteredTool entry = new RegisteredTool(tool, quota, tool.isTerminal());
            if (index.put(tool.getName(), entry) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}] quota={} terminal={}",
                    tool.getName(), quota != null ? quota : "unlimited", tool.isTerminal());
        });

        this.tools = Collections.unmodifiableMap(index);
        this.definitions = index.values().stream()
                .map(ToolDefinition::of)
                .toList();
        log.info("Total tools registered: {}", tools.size());
    }

    public Optional<RegisteredTool> lookup(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolDefinition> getAllDefinitions() {
        return definitions;
    }

    /** Initial usage counters: zero for every tool that declares a quota */
    public Map<String, Integer> initialUsage() {
        Map<String, Integer> usage = new LinkedHashMap<>();
        tools.values().stream()
                .filter(RegisteredTool::hasQuota)
                .forEach(entry -> usage.put(entry.name(), 0));
        return usage;
    }

    public int toolCount() {
        return tools.size();
    }

    private static Integer normalize(Integer configured) {
        return configured == null || configured < 0 ? null : configured;
    }
}
