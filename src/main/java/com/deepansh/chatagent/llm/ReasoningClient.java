package com.deepansh.chatagent.llm;

public interface ReasoningClient {

    /**
     * One completion call. Returns whatever the service decided: tool calls,
     * text content, or (a protocol violation the caller must reject) neither.
     *
     * @throws com.deepansh.chatagent.exception.ReasoningException on transport or parse failure
     */
    ReasoningResponse reason(ReasoningRequest request);
}
