package com.deepansh.chatagent.core;

import com.deepansh.chatagent.cancel.CancellationRegistry;
import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.delivery.DeliveryReport;
import com.deepansh.chatagent.delivery.DeliverySplitter;
import com.deepansh.chatagent.exception.AgentException;
import com.deepansh.chatagent.exception.ReasoningException;
import com.deepansh.chatagent.exception.UnknownToolException;
import com.deepansh.chatagent.llm.ReasoningClient;
import com.deepansh.chatagent.llm.ReasoningRequest;
import com.deepansh.chatagent.llm.ReasoningResponse;
import com.deepansh.chatagent.model.Message;
import com.deepansh.chatagent.model.TerminationOutcome;
import com.deepansh.chatagent.model.ToolInvocation;
import com.deepansh.chatagent.observability.TraceService;
import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationSink;
import com.deepansh.chatagent.status.StatusReporter;
import com.deepansh.chatagent.tool.RegisteredTool;
import com.deepansh.chatagent.tool.ToolActivityDescriber;
import com.deepansh.chatagent.tool.ToolDefinition;
import com.deepansh.chatagent.tool.ToolRegistry;
import com.deepansh.chatagent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reason / act loop for one session.
 *
 * Per iteration:
 * 1. Consume a pending cancellation for the chat
 * 2. Stop at the iteration budget
 * 3. Ask the reasoning service for a tool or a final answer (timed)
 * 4. Run the first proposed tool (quota-checked, timed) and fold its result
 *    into the session context, or stop on a final answer / terminal tool
 *
 * After the loop the outcome is delivered (answer chunks, notice, or nothing
 * for a terminal tool), the query is persisted, and the trace is written.
 * {@link #run} never throws.
 */
@Service
@Slf4j
public class AgentOrchestrator {

    static final String CANCELLED_NOTICE = "🛑 Operation cancelled by user request.";
    static final String INCOMPLETE_NOTICE =
            "I couldn't complete the research within the allowed steps. Please try asking a more specific question.";
    static final String FAILURE_NOTICE =
            "Sorry, I encountered an error while processing your request. Please try again.";

    private final ReasoningClient reasoningClient;
    private final ToolRegistry toolRegistry;
    private final ToolActivityDescriber activityDescriber;
    private final StatusReporter statusReporter;
    private final DeliverySplitter deliverySplitter;
    private final CancellationRegistry cancellationRegistry;
    private final ConversationSink conversationSink;
    private final SystemPromptFactory promptFactory;
    private final TraceService traceService;
    private final AgentProperties properties;
    private final ExecutorService callExecutor;

    public AgentOrchestrator(ReasoningClient reasoningClient,
                             ToolRegistry toolRegistry,
                             ToolActivityDescriber activityDescriber,
                             StatusReporter statusReporter,
                             DeliverySplitter deliverySplitter,
                             CancellationRegistry cancellationRegistry,
                             ConversationSink conversationSink,
                             SystemPromptFactory promptFactory,
                             TraceService traceService,
                             AgentProperties properties,
                             @Qualifier("agentCallExecutor") ExecutorService callExecutor) {
        this.reasoningClient = reasoningClient;
        this.toolRegistry = toolRegistry;
        this.activityDescriber = activityDescriber;
        this.statusReporter = statusReporter;
        this.deliverySplitter = deliverySplitter;
        this.cancellationRegistry = cancellationRegistry;
        this.conversationSink = conversationSink;
        this.promptFactory = promptFactory;
        this.traceService = traceService;
        this.properties = properties;
        this.callExecutor = callExecutor;
    }

    public TerminationOutcome run(Session session) {
        log.info("Session started {} [persona={}, query='{}']",
                session.logTag(), session.getPersonaId(), session.getQuery());

        try {
            loop(session);
        } catch (Exception e) {
            log.error("Session aborted unexpectedly {}", session.logTag(), e);
            if (!session.isTerminated()) {
                session.terminate(TerminationOutcome.failed(describe(e)));
            }
        }

        try {
            conclude(session);
        } catch (Exception e) {
            log.error("Failed to report outcome {} {}", session.getOutcome().kind(), session.logTag(), e);
        }

        persistQuery(session);

        try {
            traceService.persistTrace(session);
        } catch (Exception e) {
            log.error("Could not schedule trace {}", session.logTag(), e);
        }

        log.info("Session finished {} [outcome={}, loops={}, latency={}ms, tokens={}]",
                session.logTag(), session.getOutcome().kind(), session.getLoopCount(),
                session.getRunContext().elapsedMs(), session.getRunContext().totalTokens());
        return session.getOutcome();
    }

    private void loop(Session session) {
        List<ToolDefinition> tools = toolRegistry.getAllDefinitions();
        String systemPrompt = promptFactory.build(session.getPersonaId(), tools);
        int maxLoops = properties.getMaxLoops();

        while (!session.isTerminated()) {
            if (cancellationRegistry.consume(session.getChatId())) {
                log.info("Cancellation observed before iteration {} {}", session.getLoopCount() + 1, session.logTag());
                session.terminate(TerminationOutcome.CANCELLED);
                return;
            }

            if (session.getLoopCount() >= maxLoops) {
                log.warn("Iteration budget ({}) exhausted {}", maxLoops, session.logTag());
                session.terminate(TerminationOutcome.TIMED_OUT);
                return;
            }

            int iteration = session.nextIteration();
            log.info("Iteration {}/{} {}", iteration, maxLoops, session.logTag());

            ReasoningResponse response;
            try {
                response = reason(session, systemPrompt, tools);
            } catch (Exception e) {
                log.error("Reasoning failed on iteration {} {}: {}", iteration, session.logTag(), describe(e));
                session.terminate(TerminationOutcome.failed("Reasoning failed: " + describe(e)));
                return;
            }

            if (response.hasToolCall()) {
                act(session, response, systemPrompt);
            } else if (response.hasContent()) {
                session.terminate(TerminationOutcome.finalContent(response.getContent()));
            } else {
                log.error("Reasoning returned neither a tool call nor content {}", session.logTag());
                session.terminate(TerminationOutcome.failed("Reasoning service returned an empty response"));
            }
        }
    }

    private void act(Session session, ReasoningResponse response, String systemPrompt) {
        ToolInvocation call = response.firstToolCall();
        if (response.getToolCalls().size() > 1) {
            log.debug("Ignoring {} extra proposed tool calls {}", response.getToolCalls().size() - 1, session.logTag());
        }

        String name = call.getName();
        RegisteredTool entry;
        try {
            entry = toolRegistry.lookup(name).orElseThrow(() -> new UnknownToolException(name));
        } catch (UnknownToolException e) {
            log.error("Reasoning proposed unregistered tool [{}] {}", name, session.logTag());
            session.terminate(TerminationOutcome.failed(e.getMessage()));
            return;
        }

        if (entry.hasQuota()) {
            if (session.usageOf(name) >= entry.quota()) {
                log.warn("Quota for [{}] exhausted ({}/{}) {}", name, session.usageOf(name), entry.quota(), session.logTag());
                session.appendContext("\n" + name + " quota exhausted: limit of " + entry.quota()
                        + " calls reached. Answer with the information gathered so far.\n");
                session.markQuotaExhausted(name);
                afterQuotaExhausted(session, systemPrompt);
                return;
            }
            session.recordToolUse(name);
        }

        statusReporter.update(session.getStatusHandle(), activityDescriber.describe(name, call.getArguments()));
        log.info("Executing tool [{}] {}", name, session.logTag());

        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        long start = System.currentTimeMillis();
        ToolResult result;
        try {
            result = timed(() -> entry.tool().execute(arguments, session.getChatId()), properties.getToolTimeout());
        } catch (TimeoutException e) {
            recordToolFailure(session, call, start,
                    "timed out after " + properties.getToolTimeout().toMillis() + "ms");
            return;
        } catch (ExecutionException e) {
            recordToolFailure(session, call, start, describe(e.getCause()));
            return;
        }
        long latency = System.currentTimeMillis() - start;

        if (entry.terminal()) {
            int delivered = result != null && result.isDelivered() ? result.getDeliveredCount() : 0;
            session.getRunContext().recordToolCall(name, latency, true, "delivered " + delivered + " messages");
            log.info("Terminal tool [{}] delivered {} messages {}", name, delivered, session.logTag());
            session.terminate(TerminationOutcome.messagesDelivered(delivered));
            return;
        }

        String text = result != null && result.getText() != null ? result.getText() : "";
        call.setResultText(text);
        session.getRunContext().recordToolCall(name, latency, true, text);
        session.appendContext("\n" + name + " result:\n" + text + "\n");
    }

    /**
     * Quota hit: stop without a final answer, or, when enabled and budget
     * remains, spend one tool-less reasoning call on a synthesized answer.
     */
    private void afterQuotaExhausted(Session session, String systemPrompt) {
        if (!properties.isQuotaExhaustedSynthesis() || session.getLoopCount() >= properties.getMaxLoops()) {
            session.terminate(TerminationOutcome.TIMED_OUT);
            return;
        }

        int iteration = session.nextIteration();
        log.info("Synthesis call on iteration {} after quota exhaustion {}", iteration, session.logTag());
        try {
            ReasoningResponse response = reason(session, systemPrompt, List.of());
            if (response.hasContent()) {
                session.terminate(TerminationOutcome.finalContent(response.getContent()));
                return;
            }
            log.warn("Synthesis call produced no content {}", session.logTag());
        } catch (Exception e) {
            log.warn("Synthesis call failed {}: {}", session.logTag(), describe(e));
        }
        session.terminate(TerminationOutcome.TIMED_OUT);
    }

    private ReasoningResponse reason(Session session, String systemPrompt, List<ToolDefinition> tools)
            throws TimeoutException, ExecutionException {
        ReasoningRequest request = new ReasoningRequest(
                List.of(Message.system(systemPrompt), Message.user(userContent(session))),
                tools);

        ReasoningResponse response = timed(() -> reasoningClient.reason(request), properties.getReasoningTimeout());
        if (response == null) {
            throw new ReasoningException("Reasoning service returned no response");
        }
        session.getRunContext().recordReasoningCall(response.getPromptTokens(), response.getCompletionTokens());
        return response;
    }

    /**
     * Runs the call on the call pool and waits at most {@code timeout}.
     * On expiry the call is cancelled with interruption and abandoned.
     */
    private <T> T timed(Callable<T> call, Duration timeout) throws TimeoutException, ExecutionException {
        Future<T> future = callExecutor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AgentException("Session interrupted while waiting for a call", e);
        }
    }

    private void recordToolFailure(Session session, ToolInvocation call, long start, String message) {
        long latency = System.currentTimeMillis() - start;
        log.warn("Tool [{}] failed {}: {}", call.getName(), session.logTag(), message);
        call.setErrorText(message);
        session.getRunContext().recordToolCall(call.getName(), latency, false, message);
        session.appendContext("\n" + call.getName() + " failed: " + message + "\n");
    }

    private void conclude(Session session) {
        TerminationOutcome outcome = session.getOutcome();
        switch (outcome.kind()) {
            case FINAL_CONTENT -> {
                DeliveryReport report = deliverySplitter.deliver(outcome.text(), session);
                session.setChunksDelivered(report.chunksSent());
                if (report.failed()) {
                    log.error("Answer only partially delivered ({} chunks) {}", report.chunksSent(), session.logTag());
                }
            }
            case MESSAGES_DELIVERED -> {
                session.setChunksDelivered(outcome.delivered());
                statusReporter.release(session.getStatusHandle());
            }
            case TIMED_OUT -> deliverySplitter.deliverNotice(session, INCOMPLETE_NOTICE);
            case CANCELLED -> deliverySplitter.showNotice(session, CANCELLED_NOTICE);
            case FAILED -> deliverySplitter.showNotice(session, FAILURE_NOTICE);
            default -> log.error("Session ended without a terminal outcome {}", session.logTag());
        }
    }

    private void persistQuery(Session session) {
        try {
            conversationSink.append(session.getChatId(), ConversationRecord.fromUser(
                    session.getChatId(), session.getSender(), session.getQuery(), session.getRequestMessageId()));
        } catch (Exception e) {
            log.error("Failed to persist query {}: {}", session.logTag(), e.getMessage());
        }
    }

    static String userContent(Session session) {
        StringBuilder content = new StringBuilder("Question: ").append(session.getQuery());

        if (!session.getRecentHistory().isEmpty()) {
            content.append("\n\nRecent conversation context:\n");
            session.getRecentHistory().forEach(record -> content
                    .append(record.isFromBot() ? "Bot" : record.getSender())
                    .append(": ")
                    .append(record.getText())
                    .append('\n'));
        }

        String accumulated = session.getAccumulatedContext();
        if (!accumulated.isEmpty()) {
            content.append("\n\nResearch so far:").append(accumulated);
        }
        return content.toString();
    }

    private static String describe(Throwable e) {
        if (e == null) return "unknown error";
        Throwable root = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        if (root instanceof TimeoutException) return "timed out";
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
