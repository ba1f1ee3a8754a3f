package com.deepansh.chatagent.llm;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the provider client that adds a circuit breaker.
 *
 * No retry and no fallback answer: a failed reasoning call fails the
 * session. While the circuit is open, calls fail fast with
 * CallNotPermittedException.
 *
 * Circuit breaker config (application.yml, instance "reasoningClient"):
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing probe calls (half-open state)
 * - ReasoningException (bad key, bad request, malformed output) is ignored
 */
@Component
@Primary
@Slf4j
public class ResilientReasoningClient implements ReasoningClient {

    private final ReasoningClient delegate;

    public ResilientReasoningClient(@Qualifier("providerReasoningClient") ReasoningClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "reasoningClient")
    public ReasoningResponse reason(ReasoningRequest request) {
        return delegate.reason(request);
    }
}
