package com.giveawaybot.domain.mailing.service;

import java.time.Duration;

/**
 * Suspension point of delivery loops. Tests plug in a recording sleeper instead of real waits.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
