package com.deepansh.chatagent.cancel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-instance registry. Entries live until the chat's next iteration
 * boundary consumes them, so the set stays small without eviction.
 */
@Component
@ConditionalOnProperty(name = "agent.cancellation.store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryCancellationRegistry implements CancellationRegistry {

    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    @Override
    public void request(String chatId) {
        pending.add(chatId);
        log.info("Cancellation requested [chat={}]", chatId);
    }

    @Override
    public boolean consume(String chatId) {
        return pending.remove(chatId);
    }

    int size() {
        return pending.size();
    }
}
