package com.deepansh.chatagent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    @NotBlank(message = "chatId must not be blank")
    private String chatId;

    @NotBlank(message = "query must not be blank")
    private String query;

    /**
     * Optional. selects the system prompt persona (e.g. "scientist").
     * Null, "default" and "robot" all mean the default assistant.
     */
    private String personaId;

    /** Optional. display name of the requesting user, stored on the query record */
    private String sender;

    /** Optional. platform message id of the request; progress and answers reply to it */
    private String requestMessageId;
}
