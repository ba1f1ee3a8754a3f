package com.deepansh.chatagent.tool.impl;

import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationStore;
import com.deepansh.chatagent.tool.AgentTool;
import com.deepansh.chatagent.tool.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up the current chat's stored history.
 *
 * Actions:
 * - get:     messages from the last N hours (default 24, max 168)
 * - search:  case-insensitive substring search, newest first
 * - summary: message counts by human / bot and the most active senders
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MessagesTool implements AgentTool {

    private static final int MAX_HOURS = 168;
    private static final int MAX_GET_RECORDS = 200;
    private static final int DEFAULT_SEARCH_RESULTS = 20;
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final ConversationStore conversationStore;

    @Override
    public String getName() {
        return "messages";
    }

    @Override
    public String getDescription() {
        return """
                Look up this chat's message history.
                action "get" returns messages from the last N hours, "search" finds messages
                containing a phrase, "summary" gives activity counts and the most active senders.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "action", Map.of(
                                "type", "string",
                                "enum", List.of("get", "search", "summary")
                        ),
                        "hours", Map.of(
                                "type", "integer",
                                "description", "Lookback window in hours for get / summary. Default: 24"
                        ),
                        "query", Map.of(
                                "type", "string",
                                "description", "Phrase to look for, required for search"
                        )
                ),
                "required", List.of("action")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, String chatId) {
        String action = arguments.getOrDefault("action", "get").toString();
        Duration lookback = Duration.ofHours(resolveHours(arguments.get("hours")));

        log.info("Messages lookup: action={} [chat={}]", action, chatId);

        return ToolResult.text(switch (action) {
            case "get" -> render("Messages from the last " + lookback.toHours() + "h",
                    conversationStore.recent(chatId, lookback, MAX_GET_RECORDS));
            case "search" -> search(chatId, arguments.get("query"));
            case "summary" -> summary(chatId, lookback);
            default -> throw new IllegalArgumentException(
                    "unknown action '" + action + "', expected get, search or summary");
        });
    }

    private String search(String chatId, Object rawQuery) {
        if (rawQuery == null || rawQuery.toString().isBlank()) {
            throw new IllegalArgumentException("'query' is required for action search");
        }
        String query = rawQuery.toString();
        return render("Messages matching \"" + query + "\"",
                conversationStore.search(chatId, query, DEFAULT_SEARCH_RESULTS));
    }

    private String summary(String chatId, Duration lookback) {
        long human = conversationStore.count(chatId, false, lookback);
        long bot = conversationStore.count(chatId, true, lookback);

        Map<String, Long> bySender = conversationStore.recent(chatId, lookback, MAX_GET_RECORDS).stream()
                .filter(r -> !r.isFromBot())
                .collect(Collectors.groupingBy(
                        r -> r.getSender() != null ? r.getSender() : "unknown", Collectors.counting()));

        String topSenders = bySender.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(5)
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));

        return "Conversation summary for the last " + lookback.toHours() + "h:\n"
                + "- user messages: " + human + "\n"
                + "- bot messages: " + bot + "\n"
                + "- most active: " + (topSenders.isEmpty() ? "nobody" : topSenders);
    }

    private String render(String heading, List<ConversationRecord> records) {
        if (records.isEmpty()) {
            return heading + ": none found.";
        }
        Function<ConversationRecord, String> line = r -> String.format("%s %s %s: %s",
                r.getTimestamp() != null ? TIME_FORMAT.format(r.getTimestamp()) : "unknown time",
                r.isFromBot() ? "[bot]" : "[user]",
                r.getSender(),
                r.getText());
        return heading + " (" + records.size() + "):\n"
                + records.stream().map(line).collect(Collectors.joining("\n"));
    }

    private static long resolveHours(Object raw) {
        if (raw == null) return 24;
        try {
            long hours = (long) Double.parseDouble(raw.toString());
            return Math.min(Math.max(hours, 1), MAX_HOURS);
        } catch (NumberFormatException e) {
            return 24;
        }
    }
}
