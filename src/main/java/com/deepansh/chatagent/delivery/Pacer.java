package com.deepansh.chatagent.delivery;

import java.time.Duration;

/**
 * Waits between consecutive outbound messages.
 */
@FunctionalInterface
public interface Pacer {

    void pause(Duration delay) throws InterruptedException;
}
