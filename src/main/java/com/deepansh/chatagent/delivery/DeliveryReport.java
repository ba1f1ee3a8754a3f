package com.deepansh.chatagent.delivery;

/**
 * @param chunksSent   formatted chunks the platform accepted
 * @param usedFallback the plain-text fallback was attempted
 * @param failed       some content never reached the chat
 */
public record DeliveryReport(int chunksSent, boolean usedFallback, boolean failed) {
}
