package com.deepansh.chatagent.observability;

import com.deepansh.chatagent.model.TerminationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted trace of one session: what was asked, how it ended, and what it cost.
 */
@Document(collection = "agent_run_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunTrace {

    @Id
    private String id;

    @Indexed
    private String sessionId;

    @Indexed
    private String chatId;

    private String personaId;

    private String query;

    private TerminationOutcome.Kind outcome;

    private String finalAnswer;

    private String errorMessage;

    private int loopsUsed;

    /** Tool whose quota ended the session, if any */
    private String quotaExhaustedTool;

    private Map<String, Integer> toolUsage;

    /** Tool calls in execution order */
    private List<RunContext.ToolCallRecord> toolCalls;

    private long totalLatencyMs;

    private int reasoningCalls;
    private int promptTokens;
    private int completionTokens;

    @CreatedDate
    @Indexed
    private Instant createdAt;
}
