package com.deepansh.chatagent.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentRunTraceRepository extends MongoRepository<AgentRunTrace, String> {

    List<AgentRunTrace> findByChatIdOrderByCreatedAtDesc(String chatId);

    List<AgentRunTrace> findBySessionId(String sessionId);

    @Aggregation(pipeline = {
        "{ $match: { 'chatId': ?0 } }",
        "{ $group: { _id: null, avg: { $avg: '$totalLatencyMs' } } }"
    })
    Double avgLatencyForChat(String chatId);

    @Aggregation(pipeline = {
        "{ $match: { 'chatId': ?0 } }",
        "{ $group: { _id: '$outcome', count: { $sum: 1 } } }"
    })
    List<OutcomeCount> outcomeBreakdownForChat(String chatId);

    record OutcomeCount(String id, long count) {}
}
