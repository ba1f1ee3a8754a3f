package com.deepansh.chatagent.tool.impl;

import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessagesToolTest {

    @Mock ConversationStore conversationStore;

    @InjectMocks
    MessagesTool tool;

    @Test
    void get_rendersRecordsWithinWindow() {
        when(conversationStore.recent("c1", Duration.ofHours(6), 200)).thenReturn(List.of(
                record("alice", false, "pizza tonight?"),
                record("Everything Bot", true, "Sounds good")));

        String text = tool.execute(Map.of("action", "get", "hours", 6), "c1").getText();

        assertThat(text).startsWith("Messages from the last 6h (2):");
        assertThat(text).contains("[user] alice: pizza tonight?", "[bot] Everything Bot: Sounds good");
    }

    @Test
    void search_requiresQuery() {
        assertThatThrownBy(() -> tool.execute(Map.of("action", "search"), "c1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("query");
    }

    @Test
    void search_noMatches() {
        when(conversationStore.search("c1", "tacos", 20)).thenReturn(List.of());

        assertThat(tool.execute(Map.of("action", "search", "query", "tacos"), "c1").getText())
                .isEqualTo("Messages matching \"tacos\": none found.");
    }

    @Test
    void summary_countsAndRanksSenders() {
        when(conversationStore.count(eq("c1"), eq(false), any())).thenReturn(3L);
        when(conversationStore.count(eq("c1"), eq(true), any())).thenReturn(1L);
        when(conversationStore.recent(eq("c1"), any(), anyInt())).thenReturn(List.of(
                record("bob", false, "a"), record("alice", false, "b"),
                record("bob", false, "c"), record(null, false, "d")));

        String text = tool.execute(Map.of("action", "summary"), "c1").getText();

        assertThat(text).contains("user messages: 3", "bot messages: 1", "most active: bob (2)");
    }

    @Test
    void unknownAction_throws() {
        assertThatThrownBy(() -> tool.execute(Map.of("action", "delete"), "c1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ConversationRecord record(String sender, boolean fromBot, String text) {
        return ConversationRecord.builder()
                .chatId("c1").sender(sender).fromBot(fromBot).text(text)
                .timestamp(Instant.parse("2025-01-01T10:00:00Z"))
                .build();
    }
}
