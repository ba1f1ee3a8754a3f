package com.deepansh.chatagent.tool.impl;

import com.deepansh.chatagent.chat.ChatGateway;
import com.deepansh.chatagent.chat.MessageRef;
import com.deepansh.chatagent.chat.SendOptions;
import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.config.ToolProperties;
import com.deepansh.chatagent.exception.ChatGatewayException;
import com.deepansh.chatagent.persistence.ConversationSink;
import com.deepansh.chatagent.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SendMessagesToolTest {

    @Mock ChatGateway chatGateway;
    @Mock ConversationSink conversationSink;

    private final List<Duration> pauses = new ArrayList<>();
    private SendMessagesTool tool;

    @BeforeEach
    void setUp() {
        tool = new SendMessagesTool(chatGateway, conversationSink, pauses::add,
                new ToolProperties(), new AgentProperties());
        lenient().when(chatGateway.send(anyString(), anyString(), any(SendOptions.class)))
                .thenAnswer(inv -> new MessageRef(inv.getArgument(0), "m-" + inv.getArgument(1),
                        inv.getArgument(1), Instant.now()));
    }

    @Test
    void isTerminal() {
        assertThat(tool.isTerminal()).isTrue();
    }

    @Test
    void execute_sendsPersistsAndReturnsDeliveredMarker() throws Exception {
        ToolResult result = tool.execute(Map.of("messages", List.of("Hello", "World!")), "c1");

        assertThat(result.isDelivered()).isTrue();
        assertThat(result.getDeliveredCount()).isEqualTo(2);
        verify(chatGateway).send("c1", "Hello", SendOptions.markdown(null));
        verify(chatGateway).send("c1", "World!", SendOptions.markdown(null));
        verify(conversationSink, times(2)).append(eq("c1"), argThat(r -> r.isFromBot()));
    }

    @Test
    void execute_pausesBeforeEachFollowUpByItsLength() throws Exception {
        tool.execute(Map.of("messages", List.of("first", "0123456789", "x".repeat(500))), "c1");

        // 800ms base + 10ms per char, bonus capped at 1200ms
        assertThat(pauses).containsExactly(Duration.ofMillis(900), Duration.ofMillis(2000));
    }

    @Test
    void execute_persistenceFailure_doesNotStopSending() throws Exception {
        doThrow(new RuntimeException("db down")).when(conversationSink).append(any(), any());

        ToolResult result = tool.execute(Map.of("messages", List.of("a", "b")), "c1");

        assertThat(result.getDeliveredCount()).isEqualTo(2);
    }

    @Test
    void execute_sendFailure_propagates() {
        when(chatGateway.send(eq("c1"), eq("boom"), any())).thenThrow(new ChatGatewayException("forbidden"));

        assertThatThrownBy(() -> tool.execute(Map.of("messages", List.of("boom")), "c1"))
                .isInstanceOf(ChatGatewayException.class);
    }

    @Test
    void execute_emptyMessages_throws() {
        assertThatThrownBy(() -> tool.execute(Map.of("messages", List.of(" ")), "c1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
