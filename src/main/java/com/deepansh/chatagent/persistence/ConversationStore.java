package com.deepansh.chatagent.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * MongoDB-backed conversation history: the append sink for sent messages and
 * queries, and the read side for session history snapshots and the messages tool.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationStore implements ConversationSink {

    private final ConversationRecordRepository repository;

    @Override
    public void append(String chatId, ConversationRecord record) {
        record.setChatId(chatId);
        repository.save(record);
        log.debug("Appended {} record to chat={} [externalId={}]",
                record.isFromBot() ? "bot" : "user", chatId, record.getExternalMessageId());
    }

    /**
     * Most recent records within the lookback window, oldest first, at most maxRecords.
     */
    public List<ConversationRecord> recent(String chatId, Duration lookback, int maxRecords) {
        Instant since = Instant.now().minus(lookback);
        List<ConversationRecord> newestFirst = repository.findByChatIdAndTimestampAfterOrderByTimestampDesc(
                chatId, since, PageRequest.of(0, Math.max(1, maxRecords)));
        List<ConversationRecord> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        return ordered;
    }

    /**
     * Case-insensitive substring search, newest first.
     */
    public List<ConversationRecord> search(String chatId, String term, int maxResults) {
        return repository.searchText(chatId, Pattern.quote(term),
                PageRequest.of(0, Math.max(1, maxResults), Sort.by(Sort.Direction.DESC, "timestamp")));
    }

    public long count(String chatId, boolean fromBot, Duration lookback) {
        return repository.countByChatIdAndFromBotAndTimestampAfter(
                chatId, fromBot, Instant.now().minus(lookback));
    }
}
