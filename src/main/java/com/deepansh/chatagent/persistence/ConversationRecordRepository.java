package com.deepansh.chatagent.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ConversationRecordRepository extends MongoRepository<ConversationRecord, String> {

    List<ConversationRecord> findByChatIdAndTimestampAfterOrderByTimestampDesc(
            String chatId, Instant since, Pageable page);

    @Query("{ 'chatId': ?0, 'text': { $regex: ?1, $options: 'i' } }")
    List<ConversationRecord> searchText(String chatId, String quotedPattern, Pageable page);

    long countByChatIdAndFromBotAndTimestampAfter(String chatId, boolean fromBot, Instant since);
}
