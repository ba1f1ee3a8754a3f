package com.deepansh.chatagent.delivery;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SleepingPacer implements Pacer {

    @Override
    public void pause(Duration delay) throws InterruptedException {
        if (!delay.isNegative() && !delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
