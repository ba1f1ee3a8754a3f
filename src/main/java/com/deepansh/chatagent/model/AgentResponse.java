package com.deepansh.chatagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    private String sessionId;
    private String chatId;
    private TerminationOutcome.Kind outcome;

    /** Present when outcome = FINAL_CONTENT */
    private String finalAnswer;

    /** Present when outcome = FAILED */
    private String error;

    private int loopsUsed;

    @Builder.Default
    private Map<String, Integer> toolUsage = new HashMap<>();

    private int chunksDelivered;
}
