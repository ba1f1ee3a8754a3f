package com.deepansh.chatagent.tool;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Turns a tool invocation into the one-line progress text shown in the
 * status message while the tool runs.
 */
@Component
public class ToolActivityDescriber {

    private static final Map<String, String> SEARCH_TOPICS = Map.of(
            "web", "web",
            "news", "news",
            "reddit", "Reddit",
            "images", "images",
            "videos", "videos");

    public String describe(String toolName, Map<String, Object> args) {
        Map<String, Object> a = args != null ? args : Map.of();

        return switch (toolName) {
            case "web_search" -> "Searching " + SEARCH_TOPICS.getOrDefault(str(a, "topic", "web"), "web")
                    + " for: \"" + str(a, "query", "") + "\"";
            case "calculate" -> "Calculating: " + str(a, "expression", "");
            case "fetch_url" -> "Fetching content from: " + str(a, "url", "");
            case "messages" -> describeMessages(a);
            case "send_messages" -> "Sending " + countMessages(a.get("messages")) + " chat messages";
            default -> "Executing " + toolName;
        };
    }

    private String describeMessages(Map<String, Object> a) {
        String action = str(a, "action", "get");
        return switch (action) {
            case "get" -> "Retrieving messages from the last " + str(a, "hours", "24") + "h";
            case "search" -> "Searching chat history for: \"" + str(a, "query", "") + "\"";
            case "summary" -> "Generating conversation summary (" + str(a, "hours", "24") + "h)";
            default -> "Processing messages (" + action + ")";
        };
    }

    private static int countMessages(Object messages) {
        if (messages instanceof Collection<?> c && !c.isEmpty()) {
            return c.size();
        }
        return 1;
    }

    private static String str(Map<String, Object> args, String key, String fallback) {
        Object value = args.get(key);
        return value != null ? value.toString() : fallback;
    }
}
