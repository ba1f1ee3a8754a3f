package com.deepansh.chatagent.core;

import com.deepansh.chatagent.cancel.InMemoryCancellationRegistry;
import com.deepansh.chatagent.chat.ChatGateway;
import com.deepansh.chatagent.chat.MessageRef;
import com.deepansh.chatagent.chat.SendOptions;
import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.config.ToolProperties;
import com.deepansh.chatagent.delivery.DeliverySplitter;
import com.deepansh.chatagent.llm.ReasoningClient;
import com.deepansh.chatagent.llm.ReasoningRequest;
import com.deepansh.chatagent.llm.ReasoningResponse;
import com.deepansh.chatagent.model.TerminationOutcome;
import com.deepansh.chatagent.model.ToolInvocation;
import com.deepansh.chatagent.observability.TraceService;
import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationSink;
import com.deepansh.chatagent.status.StatusReporter;
import com.deepansh.chatagent.tool.AgentTool;
import com.deepansh.chatagent.tool.ToolActivityDescriber;
import com.deepansh.chatagent.tool.ToolRegistry;
import com.deepansh.chatagent.tool.ToolResult;
import com.deepansh.chatagent.tool.impl.CalculateTool;
import com.deepansh.chatagent.tool.impl.SendMessagesTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentOrchestratorTest {

    private static final String CHAT = "chat-1";

    @Mock ReasoningClient reasoningClient;
    @Mock ChatGateway chatGateway;
    @Mock ConversationSink conversationSink;
    @Mock TraceService traceService;

    private final AtomicInteger messageIds = new AtomicInteger(100);
    private final List<AgentTool> tools = new ArrayList<>();

    private AgentProperties properties;
    private InMemoryCancellationRegistry cancellationRegistry;
    private StatusReporter statusReporter;
    private DeliverySplitter deliverySplitter;
    private ExecutorService callExecutor;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        cancellationRegistry = new InMemoryCancellationRegistry();
        statusReporter = new StatusReporter(chatGateway);
        deliverySplitter = spy(new DeliverySplitter(chatGateway, conversationSink, statusReporter, d -> { }, properties));
        callExecutor = Executors.newCachedThreadPool();

        lenient().when(chatGateway.send(anyString(), anyString(), any(SendOptions.class)))
                .thenAnswer(inv -> new MessageRef(inv.getArgument(0),
                        String.valueOf(messageIds.incrementAndGet()), inv.getArgument(1), Instant.now()));
        lenient().when(chatGateway.edit(any(MessageRef.class), anyString()))
                .thenAnswer(inv -> ((MessageRef) inv.getArgument(0)).withText(inv.getArgument(1), Instant.now()));
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    // ─── Scenarios ──────────────────────────────────────────────────────────

    @Test
    void run_toolThenAnswer_deliversFinalContentInOneChunk() {
        tools.add(new CalculateTool());
        when(reasoningClient.reason(any()))
                .thenReturn(toolCall("calculate", Map.of("expression", "2+2")))
                .thenReturn(ReasoningResponse.content("The answer is 4."));

        Session session = newSession("2+2");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FINAL_CONTENT);
        assertThat(outcome.text()).isEqualTo("The answer is 4.");
        assertThat(session.getLoopCount()).isEqualTo(2);
        assertThat(session.getChunksDelivered()).isEqualTo(1);
        assertThat(session.getAccumulatedContext()).contains("calculate result:\n4");
        assertThat(session.getRunContext().toolCalls()).hasSize(1);

        ArgumentCaptor<ReasoningRequest> requests = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient, times(2)).reason(requests.capture());
        assertThat(requests.getAllValues().get(1).messages().get(1).getContent()).contains("calculate result:\n4");

        verify(chatGateway).send(eq(CHAT), eq("The answer is 4."), eq(SendOptions.markdown("req-1")));
        verify(chatGateway).delete(any());
    }

    @Test
    void run_quotaExhausted_stopsWithoutThirdExecutionOrFourthReasoningCall() {
        StubTool search = new StubTool("search", 2, false, (args, n) -> ToolResult.text("result " + n));
        tools.add(search);
        AtomicInteger proposals = new AtomicInteger();
        when(reasoningClient.reason(any()))
                .thenAnswer(inv -> toolCall("search", Map.of("query", "q" + proposals.incrementAndGet())));

        Session session = newSession("find things");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.TIMED_OUT);
        assertThat(search.calls.get()).isEqualTo(2);
        assertThat(session.usageOf("search")).isEqualTo(2);
        assertThat(session.getQuotaExhaustedTool()).isEqualTo("search");
        assertThat(session.getAccumulatedContext()).contains("search quota exhausted");
        verify(reasoningClient, times(3)).reason(any());

        verify(chatGateway).edit(any(MessageRef.class), eq(AgentOrchestrator.INCOMPLETE_NOTICE));
        verify(conversationSink).append(eq(CHAT), argThat(r ->
                r.isFromBot() && AgentOrchestrator.INCOMPLETE_NOTICE.equals(r.getText())));
    }

    @Test
    void run_cancelledBetweenIterations_stopsBeforeNextReasoningCall() {
        properties.setMaxLoops(3);
        tools.add(new StubTool("lookup", null, false, (args, n) -> {
            if (n == 2) {
                cancellationRegistry.request(CHAT);
            }
            return ToolResult.text("partial " + n);
        }));
        when(reasoningClient.reason(any())).thenReturn(toolCall("lookup", Map.of()));

        Session session = newSession("slow question");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome).isEqualTo(TerminationOutcome.CANCELLED);
        assertThat(session.getLoopCount()).isEqualTo(2);
        verify(reasoningClient, times(2)).reason(any());
        verify(chatGateway).edit(any(MessageRef.class), eq(AgentOrchestrator.CANCELLED_NOTICE));
        assertThat(cancellationRegistry.consume(CHAT)).isFalse();
    }

    @Test
    void run_neverAnswers_timesOutAfterMaxLoopsAndPersistsNotice() {
        properties.setMaxLoops(3);
        tools.add(new StubTool("lookup", null, false, (args, n) -> ToolResult.text("more data")));
        when(reasoningClient.reason(any())).thenReturn(toolCall("lookup", Map.of()));

        Session session = newSession("endless");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome).isEqualTo(TerminationOutcome.TIMED_OUT);
        assertThat(session.getLoopCount()).isEqualTo(3);
        verify(reasoningClient, times(3)).reason(any());
        verify(deliverySplitter, never()).deliver(anyString(), any());
        verify(chatGateway).edit(any(MessageRef.class), eq(AgentOrchestrator.INCOMPLETE_NOTICE));
        verify(conversationSink).append(eq(CHAT), argThat(r ->
                r.isFromBot() && AgentOrchestrator.INCOMPLETE_NOTICE.equals(r.getText())));
    }

    @Test
    void run_terminalTool_endsWithMessagesDeliveredAndReleasesStatusOnce() {
        tools.add(new SendMessagesTool(chatGateway, conversationSink, d -> { }, new ToolProperties(), properties));
        when(reasoningClient.reason(any()))
                .thenReturn(toolCall("send_messages", Map.of("messages", List.of("first", "second"))));

        Session session = newSession("tell me");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.MESSAGES_DELIVERED);
        assertThat(outcome.delivered()).isEqualTo(2);
        assertThat(session.getLoopCount()).isEqualTo(1);
        verify(reasoningClient, times(1)).reason(any());
        verify(deliverySplitter, never()).deliver(anyString(), any());
        verify(deliverySplitter, never()).deliver(anyList(), any());
        verify(chatGateway).send(CHAT, "first", SendOptions.markdown(null));
        verify(chatGateway).send(CHAT, "second", SendOptions.markdown(null));
        verify(chatGateway, times(1)).delete(any());
        assertThat(session.getStatusHandle().isReleased()).isTrue();
    }

    // ─── Failure paths ──────────────────────────────────────────────────────

    @Test
    void run_unknownTool_failsWithoutExecutingAnything() {
        StubTool known = new StubTool("known", null, false, (args, n) -> ToolResult.text("x"));
        tools.add(known);
        when(reasoningClient.reason(any())).thenReturn(toolCall("made_up", Map.of()));

        TerminationOutcome outcome = orchestrator().run(newSession("q"));

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FAILED);
        assertThat(outcome.error()).contains("made_up");
        assertThat(known.calls.get()).isZero();
        verify(chatGateway).edit(any(MessageRef.class), eq(AgentOrchestrator.FAILURE_NOTICE));
    }

    @Test
    void run_reasoningThrows_failsAfterSingleCall() {
        when(reasoningClient.reason(any())).thenThrow(new IllegalStateException("provider down"));

        TerminationOutcome outcome = orchestrator().run(newSession("q"));

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FAILED);
        assertThat(outcome.error()).contains("provider down");
        verify(reasoningClient, times(1)).reason(any());
        verify(chatGateway).edit(any(MessageRef.class), eq(AgentOrchestrator.FAILURE_NOTICE));
    }

    @Test
    void run_failedWithoutStatusMessage_sendsFailureNoticeAsNewMessage() {
        when(reasoningClient.reason(any())).thenThrow(new IllegalStateException("provider down"));
        Session session = detachedSession("q");

        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FAILED);
        verify(chatGateway).send(CHAT, AgentOrchestrator.FAILURE_NOTICE, SendOptions.plainReply("req-1"));
        verify(chatGateway, never()).edit(any(), anyString());
        assertThat(session.getStatusHandle().isReleased()).isTrue();
    }

    @Test
    void run_cancelledWithoutStatusMessage_sendsCancelNoticeAsNewMessage() {
        cancellationRegistry.request(CHAT);

        TerminationOutcome outcome = orchestrator().run(detachedSession("q"));

        assertThat(outcome).isEqualTo(TerminationOutcome.CANCELLED);
        verify(chatGateway).send(CHAT, AgentOrchestrator.CANCELLED_NOTICE, SendOptions.plainReply("req-1"));
    }

    @Test
    void run_failed_releasesStatusHandleWithoutDeletingIt() {
        when(reasoningClient.reason(any())).thenThrow(new IllegalStateException("provider down"));
        Session session = newSession("q");

        orchestrator().run(session);
        statusReporter.update(session.getStatusHandle(), "late update");

        assertThat(session.getStatusHandle().isReleased()).isTrue();
        verify(chatGateway, times(1)).edit(any(MessageRef.class), anyString());
        verify(chatGateway, never()).delete(any());
    }

    @Test
    void run_reasoningTimeout_failsSession() {
        properties.setReasoningTimeout(Duration.ofMillis(50));
        when(reasoningClient.reason(any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return ReasoningResponse.content("too late");
        });

        TerminationOutcome outcome = orchestrator().run(newSession("q"));

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FAILED);
        assertThat(outcome.error()).contains("timed out");
    }

    @Test
    void run_emptyReasoningResponse_failsAsProtocolViolation() {
        when(reasoningClient.reason(any())).thenReturn(ReasoningResponse.builder().build());

        TerminationOutcome outcome = orchestrator().run(newSession("q"));

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FAILED);
        assertThat(outcome.error()).contains("empty response");
    }

    @Test
    void run_toolError_isAnnotatedAndLoopContinues() {
        tools.add(new StubTool("flaky", null, false, (args, n) -> {
            throw new IllegalStateException("boom");
        }));
        when(reasoningClient.reason(any()))
                .thenReturn(toolCall("flaky", Map.of()))
                .thenReturn(ReasoningResponse.content("Done anyway."));

        Session session = newSession("q");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FINAL_CONTENT);
        assertThat(session.getAccumulatedContext()).contains("flaky failed: boom");
        assertThat(session.getRunContext().toolCalls().get(0).success()).isFalse();
    }

    @Test
    void run_toolTimeout_isRecoveredAsToolError() {
        properties.setToolTimeout(Duration.ofMillis(50));
        tools.add(new StubTool("slow", null, false, (args, n) -> {
            Thread.sleep(5_000);
            return ToolResult.text("never");
        }));
        when(reasoningClient.reason(any()))
                .thenReturn(toolCall("slow", Map.of()))
                .thenReturn(ReasoningResponse.content("Answer without it."));

        Session session = newSession("q");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FINAL_CONTENT);
        assertThat(session.getAccumulatedContext()).contains("slow failed: timed out after 50ms");
    }

    @Test
    void run_multipleProposedCalls_onlyFirstExecutes() {
        StubTool first = new StubTool("first", null, false, (args, n) -> ToolResult.text("one"));
        StubTool second = new StubTool("second", null, false, (args, n) -> ToolResult.text("two"));
        tools.add(first);
        tools.add(second);
        ReasoningResponse both = ReasoningResponse.builder()
                .toolCalls(List.of(invocation("first", Map.of()), invocation("second", Map.of())))
                .build();
        when(reasoningClient.reason(any()))
                .thenReturn(both)
                .thenReturn(ReasoningResponse.content("ok"));

        orchestrator().run(newSession("q"));

        assertThat(first.calls.get()).isEqualTo(1);
        assertThat(second.calls.get()).isZero();
    }

    @Test
    void run_quotaExhaustedWithSynthesisEnabled_makesOneToollessCall() {
        properties.setQuotaExhaustedSynthesis(true);
        tools.add(new StubTool("search", 1, false, (args, n) -> ToolResult.text("fact")));
        when(reasoningClient.reason(any()))
                .thenReturn(toolCall("search", Map.of("query", "a")))
                .thenReturn(toolCall("search", Map.of("query", "b")))
                .thenReturn(ReasoningResponse.content("Best effort answer."));

        Session session = newSession("q");
        TerminationOutcome outcome = orchestrator().run(session);

        assertThat(outcome.kind()).isEqualTo(TerminationOutcome.Kind.FINAL_CONTENT);
        assertThat(outcome.text()).isEqualTo("Best effort answer.");
        assertThat(session.getLoopCount()).isEqualTo(3);

        ArgumentCaptor<ReasoningRequest> requests = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient, times(3)).reason(requests.capture());
        assertThat(requests.getAllValues().get(2).tools()).isEmpty();
    }

    @Test
    void run_anyOutcome_persistsQueryAndSchedulesTrace() {
        when(reasoningClient.reason(any())).thenReturn(ReasoningResponse.content("hi"));

        Session session = newSession("hello there");
        orchestrator().run(session);

        verify(conversationSink).append(eq(CHAT), argThat((ConversationRecord r) ->
                !r.isFromBot() && "hello there".equals(r.getText()) && "req-1".equals(r.getExternalMessageId())));
        verify(traceService).persistTrace(session);
    }

    @Test
    void userContent_includesHistoryAndAccumulatedContext() {
        Session session = Session.builder()
                .sessionId("s").chatId(CHAT).query("what now?")
                .recentHistory(List.of(ConversationRecord.fromUser(CHAT, "alice", "earlier question", "1")))
                .build();
        session.appendContext("\nsearch result:\nsomething\n");

        String content = AgentOrchestrator.userContent(session);

        assertThat(content).startsWith("Question: what now?");
        assertThat(content).contains("alice: earlier question");
        assertThat(content).contains("search result:\nsomething");
    }

    // ─── Helpers ────────────────────────────────────────────────────────────

    private AgentOrchestrator orchestrator() {
        ToolRegistry registry = new ToolRegistry(tools, properties);
        return new AgentOrchestrator(reasoningClient, registry, new ToolActivityDescriber(), statusReporter,
                deliverySplitter, cancellationRegistry, conversationSink, new SystemPromptFactory(),
                traceService, properties, callExecutor);
    }

    private Session newSession(String query) {
        return Session.builder()
                .sessionId("session-" + query.hashCode())
                .chatId(CHAT)
                .query(query)
                .sender("alice")
                .requestMessageId("req-1")
                .statusHandle(statusReporter.start(CHAT, "req-1"))
                .initialUsage(new ToolRegistry(tools, properties).initialUsage())
                .build();
    }

    private Session detachedSession(String query) {
        when(chatGateway.send(eq(CHAT), eq("Processing your question..."), any(SendOptions.class)))
                .thenThrow(new IllegalStateException("chat unreachable"));
        return Session.builder()
                .sessionId("session-" + query.hashCode())
                .chatId(CHAT)
                .query(query)
                .requestMessageId("req-1")
                .statusHandle(statusReporter.start(CHAT, "req-1"))
                .initialUsage(new ToolRegistry(tools, properties).initialUsage())
                .build();
    }

    private static ReasoningResponse toolCall(String name, Map<String, Object> args) {
        return ReasoningResponse.toolCall(invocation(name, args));
    }

    private static ToolInvocation invocation(String name, Map<String, Object> args) {
        return ToolInvocation.builder().id("call-" + name).name(name).arguments(args).build();
    }

    interface Behavior {
        ToolResult apply(Map<String, Object> args, int callNumber) throws Exception;
    }

    static final class StubTool implements AgentTool {

        final AtomicInteger calls = new AtomicInteger();
        private final String name;
        private final Integer quota;
        private final boolean terminal;
        private final Behavior behavior;

        StubTool(String name, Integer quota, boolean terminal, Behavior behavior) {
            this.name = name;
            this.quota = quota;
            this.terminal = terminal;
            this.behavior = behavior;
        }

        @Override public String getName() { return name; }
        @Override public String getDescription() { return "stub " + name; }
        @Override public Map<String, Object> getInputSchema() { return Map.of("type", "object"); }
        @Override public Integer getDefaultQuota() { return quota; }
        @Override public boolean isTerminal() { return terminal; }

        @Override
        public ToolResult execute(Map<String, Object> arguments, String chatId) throws Exception {
            return behavior.apply(arguments, calls.incrementAndGet());
        }
    }
}
