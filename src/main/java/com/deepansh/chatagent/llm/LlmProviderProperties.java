package com.deepansh.chatagent.llm;

import lombok.Data;

/**
 * Connection and sampling settings of one chat-completions provider,
 * bound from llm.openai / llm.groq / llm.gemini.
 */
@Data
public class LlmProviderProperties {

    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 2048;
    private double temperature = 0.3;

    /** Sent as tool_choice whenever tools are offered */
    private String toolChoice = "auto";
}
