package com.deepansh.chatagent.api;

import com.deepansh.chatagent.cancel.CancellationRegistry;
import com.deepansh.chatagent.chat.ChatGateway;
import com.deepansh.chatagent.chat.MessageRef;
import com.deepansh.chatagent.chat.SendOptions;
import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.core.AgentService;
import com.deepansh.chatagent.model.AgentRequest;
import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides what an inbound chat message means and acts on it:
 * commands, agent queries (default or persona), or plain chatter that is
 * only kept as context for later sessions.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MessageRouter {

    static final String CANCEL_ACK =
            "🛑 Cancellation requested. The bot will stop processing after the current operation.";
    static final String BUSY_NOTICE = "I'm handling too many requests right now. Please try again in a minute.";

    static final String HELP_TEXT = """
            🤖 *Everything Bot Help*

            *Basic usage:*
            • Start messages with `robot` or `x-bot` to ask questions
            • I can search the web, read pages, do math, and look through this chat

            *Examples:*
            • `robot what's the weather like?`
            • `robot calculate 15% tip on $87.50`
            • `scientist-bot, explain quantum computing`
            • `detective-bot, summarize our chat from yesterday`

            *Commands:*
            • `/help` - Show this help message
            • `/cancel` - Cancel the current bot operation""";

    private static final Pattern ROBOT = Pattern.compile("^\\s*robot[\\s,]+(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern PERSONA = Pattern.compile("^\\s*(\\w[\\w ]*?)\\s*-\\s*bot\\b[\\s,:]*(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final CancellationRegistry cancellationRegistry;
    private final ChatGateway chatGateway;
    private final ConversationSink conversationSink;
    private final AgentService agentService;
    private final AgentProperties properties;

    public enum RouteKind {
        HELP, CANCEL, QUERY, CHATTER
    }

    /**
     * @param personaId persona for QUERY routes; null for the default assistant
     * @param query     question text for QUERY routes
     */
    public record Route(RouteKind kind, String personaId, String query) {

        static Route of(RouteKind kind) {
            return new Route(kind, null, null);
        }
    }

    public static Route classify(String text) {
        String trimmed = text == null ? "" : text.trim();

        if (trimmed.startsWith("/help")) return Route.of(RouteKind.HELP);
        if (trimmed.startsWith("/cancel")) return Route.of(RouteKind.CANCEL);

        Matcher robot = ROBOT.matcher(trimmed);
        if (robot.matches()) {
            return queryOrHelp(null, robot.group(1));
        }

        Matcher persona = PERSONA.matcher(trimmed);
        if (persona.matches()) {
            String personaId = persona.group(1).trim().toLowerCase(Locale.ROOT);
            return queryOrHelp(personaId, persona.group(2));
        }

        return Route.of(RouteKind.CHATTER);
    }

    public void route(InboundMessage message) {
        if (message.fromBot()) {
            log.debug("Ignoring message from bot {} [chat={}]", message.sender(), message.chatId());
            return;
        }

        Route route = classify(message.text());
        log.info("Routing message {} as {} [chat={}]", message.messageId(), route.kind(), message.chatId());

        switch (route.kind()) {
            case HELP -> sendHelp(message);
            case CANCEL -> cancel(message);
            case QUERY -> query(message, route);
            case CHATTER -> persist(ConversationRecord.fromUser(
                    message.chatId(), message.sender(), message.text(), message.messageId()));
        }
    }

    private void sendHelp(InboundMessage message) {
        try {
            MessageRef ref = chatGateway.send(message.chatId(), HELP_TEXT, SendOptions.markdown(null));
            persist(ConversationRecord.fromBot(ref, properties.getBotName()));
        } catch (Exception e) {
            log.warn("Failed to send help [chat={}]: {}", message.chatId(), e.getMessage());
        }
    }

    private void cancel(InboundMessage message) {
        cancellationRegistry.request(message.chatId());
        try {
            chatGateway.send(message.chatId(), CANCEL_ACK, SendOptions.plainReply(message.messageId()));
        } catch (Exception e) {
            log.warn("Failed to acknowledge cancellation [chat={}]: {}", message.chatId(), e.getMessage());
        }
    }

    private void query(InboundMessage message, Route route) {
        AgentRequest request = AgentRequest.builder()
                .chatId(message.chatId())
                .query(route.query())
                .personaId(route.personaId())
                .sender(message.sender())
                .requestMessageId(message.messageId())
                .build();

        if (!agentService.submit(request)) {
            try {
                chatGateway.send(message.chatId(), BUSY_NOTICE, SendOptions.plainReply(message.messageId()));
            } catch (Exception e) {
                log.warn("Failed to send busy notice [chat={}]: {}", message.chatId(), e.getMessage());
            }
        }
    }

    private void persist(ConversationRecord record) {
        try {
            conversationSink.append(record.getChatId(), record);
        } catch (Exception e) {
            log.warn("Failed to persist message [chat={}]: {}", record.getChatId(), e.getMessage());
        }
    }

    private static Route queryOrHelp(String personaId, String query) {
        String q = query == null ? "" : query.trim();
        return q.isEmpty() ? Route.of(RouteKind.HELP) : new Route(RouteKind.QUERY, personaId, q);
    }
}
