package com.deepansh.chatagent.delivery;

import com.deepansh.chatagent.chat.ChatGateway;
import com.deepansh.chatagent.chat.MessageRef;
import com.deepansh.chatagent.chat.SendOptions;
import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.core.Session;
import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationSink;
import com.deepansh.chatagent.status.StatusReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Sends a session's final text to the chat as paced, size-bounded chunks.
 *
 * Order of effects: status message released, then chunks in order with a
 * growing pause between them, each chunk persisted right after it is sent.
 * If the platform rejects a formatted chunk, the rest of the answer goes out
 * once as plain text.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeliverySplitter {

    private final ChatGateway chatGateway;
    private final ConversationSink conversationSink;
    private final StatusReporter statusReporter;
    private final Pacer pacer;
    private final AgentProperties properties;

    public DeliveryReport deliver(String text, Session session) {
        return deliver(List.of(text), session);
    }

    public DeliveryReport deliver(List<String> messages, Session session) {
        AgentProperties.Delivery limits = properties.getDelivery();
        List<String> chunks = MessageSplitter.splitAll(messages, limits.getMaxChunkLength());
        if (chunks.size() > limits.getMaxChunks()) {
            log.warn("Answer split into {} chunks, sending first {} {}",
                    chunks.size(), limits.getMaxChunks(), session.logTag());
            chunks = chunks.subList(0, limits.getMaxChunks());
        }

        statusReporter.release(session.getStatusHandle());

        int sent = 0;
        for (int i = 0; i < chunks.size(); i++) {
            try {
                MessageRef ref = chatGateway.send(session.getChatId(), chunks.get(i),
                        SendOptions.markdown(session.getRequestMessageId()));
                sent++;
                persist(session, ref);
            } catch (Exception e) {
                log.warn("Formatted chunk {}/{} rejected, falling back to plain text {}: {}",
                        i + 1, chunks.size(), session.logTag(), e.getMessage());
                return fallback(session, chunks.subList(i, chunks.size()), sent);
            }

            if (i < chunks.size() - 1) {
                try {
                    pacer.pause(delayAfter(i));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Delivery interrupted after {} chunks {}", sent, session.logTag());
                    return new DeliveryReport(sent, false, true);
                }
            }
        }

        log.info("Delivered {} chunks {}", sent, session.logTag());
        return new DeliveryReport(sent, false, false);
    }

    /**
     * Puts a notice where the user will see it: in place of the status message
     * when possible, otherwise as a new message. The notice is persisted either way.
     */
    public void deliverNotice(Session session, String notice) {
        showNotice(session, notice).ifPresent(ref -> persist(session, ref));
    }

    /**
     * Like {@link #deliverNotice} without persisting. The status handle is
     * released in both cases.
     *
     * @return the message showing the notice; empty when nothing reached the chat
     */
    public Optional<MessageRef> showNotice(Session session, String notice) {
        Optional<MessageRef> edited = statusReporter.settle(session.getStatusHandle(), notice);
        if (edited.isPresent()) {
            return edited;
        }
        try {
            return Optional.ofNullable(chatGateway.send(session.getChatId(), notice,
                    SendOptions.plainReply(session.getRequestMessageId())));
        } catch (Exception e) {
            log.error("Could not deliver notice {}: {}", session.logTag(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Pause after chunk {@code index}: base + index * step, capped at the max */
    Duration delayAfter(int index) {
        AgentProperties.Delivery limits = properties.getDelivery();
        Duration delay = limits.getBaseDelay().plus(limits.getDelayStep().multipliedBy(index));
        return delay.compareTo(limits.getMaxDelay()) > 0 ? limits.getMaxDelay() : delay;
    }

    private DeliveryReport fallback(Session session, List<String> remaining, int sent) {
        String plain = MarkupStripper.strip(String.join("\n\n", remaining));
        int max = properties.getDelivery().getMaxChunkLength();
        if (plain.length() > max) {
            plain = plain.substring(0, max);
        }
        if (plain.isEmpty()) {
            return new DeliveryReport(sent, true, true);
        }

        try {
            MessageRef ref = chatGateway.send(session.getChatId(), plain, SendOptions.PLAIN);
            persist(session, ref);
            log.info("Plain-text fallback delivered after {} formatted chunks {}", sent, session.logTag());
            return new DeliveryReport(sent, true, false);
        } catch (Exception e) {
            log.error("Plain-text fallback failed {}: {}", session.logTag(), e.getMessage());
            return new DeliveryReport(sent, true, true);
        }
    }

    private void persist(Session session, MessageRef ref) {
        try {
            conversationSink.append(session.getChatId(), ConversationRecord.fromBot(ref, properties.getBotName()));
        } catch (Exception e) {
            log.error("Failed to persist sent message {} {}: {}", ref.messageId(), session.logTag(), e.getMessage());
        }
    }
}
