package com.deepansh.chatagent.status;

import com.deepansh.chatagent.chat.MessageRef;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single in-place progress message of one session.
 * The message ref is null when the initial send failed; every operation
 * then degrades to a no-op.
 */
public final class StatusHandle {

    private final String chatId;
    private final AtomicReference<MessageRef> message;
    private final AtomicBoolean released = new AtomicBoolean(false);

    StatusHandle(String chatId, MessageRef message) {
        this.chatId = chatId;
        this.message = new AtomicReference<>(message);
    }

    /** Handle with no backing message, for sessions that run without progress reporting */
    public static StatusHandle detached(String chatId) {
        return new StatusHandle(chatId, null);
    }

    public String chatId() {
        return chatId;
    }

    public MessageRef message() {
        return message.get();
    }

    public boolean isReleased() {
        return released.get();
    }

    void replaceMessage(MessageRef ref) {
        message.set(ref);
    }

    /** True exactly once, for the caller that performs the release */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }
}
