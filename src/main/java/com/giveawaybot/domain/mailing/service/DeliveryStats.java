package com.giveawaybot.domain.mailing.service;

import com.giveawaybot.domain.common.enums.DeliveryOutcome;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running totals of a bulk send.
 * Every attempted send lands in exactly one bucket, so successful + failed == totalSent
 * and failed == blocked + throttled + otherErrors.
 */
@Getter
public class DeliveryStats {

    private int totalSent;
    private int successful;
    private int failed;
    private int blocked;
    private int throttled;
    private int otherErrors;
    private boolean stopped;
    private Instant startTime;
    private Instant endTime;

    private final Map<Long, DeliveryOutcome> outcomes = new LinkedHashMap<>();

    void start(Instant at) {
        startTime = at;
    }

    void finish(Instant at) {
        endTime = at;
    }

    void markStopped() {
        stopped = true;
    }

    void record(Long userId, DeliveryOutcome outcome) {
        totalSent++;
        if (userId != null) {
            outcomes.put(userId, outcome);
        }
        switch (outcome) {
            case SUCCESS -> successful++;
            case BLOCKED -> {
                failed++;
                blocked++;
            }
            case RATE_LIMITED -> {
                failed++;
                throttled++;
            }
            case OTHER_ERROR -> {
                failed++;
                otherErrors++;
            }
        }
    }

    /**
     * Outcome per recipient, in send order
     */
    public Map<Long, DeliveryOutcome> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public Duration getDuration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    /**
     * Percentage of successful sends, 0 when nothing was sent
     */
    public double successRate() {
        return totalSent > 0 ? successful * 100.0 / totalSent : 0.0;
    }
}
