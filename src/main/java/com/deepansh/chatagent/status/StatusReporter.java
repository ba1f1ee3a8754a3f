package com.deepansh.chatagent.status;

import com.deepansh.chatagent.chat.ChatGateway;
import com.deepansh.chatagent.chat.MessageRef;
import com.deepansh.chatagent.chat.SendOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maintains the "what am I doing" message shown while a session runs.
 *
 * Progress reporting must never abort a session: every gateway failure is
 * logged and swallowed. Operations on a released handle are no-ops, and
 * releasing twice is harmless.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StatusReporter {

    static final String INITIAL_TEXT = "Processing your question...";

    private final ChatGateway chatGateway;

    public StatusHandle start(String chatId, String replyToMessageId) {
        try {
            MessageRef ref = chatGateway.send(chatId, INITIAL_TEXT, SendOptions.plainReply(replyToMessageId));
            log.debug("Status message {} created [chat={}]", ref.messageId(), chatId);
            return new StatusHandle(chatId, ref);
        } catch (Exception e) {
            log.warn("Could not create status message [chat={}]: {}", chatId, e.getMessage());
            return StatusHandle.detached(chatId);
        }
    }

    public void update(StatusHandle handle, String text) {
        replace(handle, text);
    }

    /**
     * Edit the status message in place.
     *
     * @return the message now showing the text; empty when nothing was edited
     */
    public Optional<MessageRef> replace(StatusHandle handle, String text) {
        if (handle == null || handle.isReleased()) {
            return Optional.empty();
        }
        MessageRef current = handle.message();
        if (current == null) {
            return Optional.empty();
        }

        try {
            MessageRef edited = chatGateway.edit(current, text);
            MessageRef effective = edited != null ? edited : current.withText(text, current.sentAt());
            handle.replaceMessage(effective);
            return Optional.of(effective);
        } catch (Exception e) {
            log.warn("Failed to edit status message {} [chat={}]: {}",
                    current.messageId(), handle.chatId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Leave a final text in the status message and release the handle
     * without deleting the message. Later updates are no-ops.
     *
     * @return the message now showing the text; empty when nothing was edited
     */
    public Optional<MessageRef> settle(StatusHandle handle, String text) {
        Optional<MessageRef> edited = replace(handle, text);
        if (handle != null) {
            handle.markReleased();
        }
        return edited;
    }

    /**
     * Delete the status message. Only the first call on a handle reaches the gateway.
     *
     * @return true if this call performed the release
     */
    public boolean release(StatusHandle handle) {
        if (handle == null || !handle.markReleased()) {
            return false;
        }
        MessageRef current = handle.message();
        if (current == null) {
            return true;
        }

        try {
            chatGateway.delete(current);
            log.debug("Deleted status message {} [chat={}]", current.messageId(), handle.chatId());
        } catch (Exception e) {
            // Already gone on the platform side is the common case here
            log.warn("Failed to delete status message {} [chat={}]: {}",
                    current.messageId(), handle.chatId(), e.getMessage());
        }
        return true;
    }
}
