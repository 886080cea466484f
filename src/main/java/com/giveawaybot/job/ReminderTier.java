package com.giveawaybot.job;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Reminder posts before a giveaway ends
 */
@Getter
public enum ReminderTier {
    THREE_DAYS("3d", Duration.ofDays(3)),
    ONE_DAY("1d", Duration.ofDays(1)),
    THREE_HOURS("3h", Duration.ofHours(3));

    private final String code;
    private final Duration offset;

    ReminderTier(String code, Duration offset) {
        this.code = code;
        this.offset = offset;
    }

    public Instant fireTime(Instant endTime) {
        return endTime.minus(offset);
    }

    public String getMessageKey() {
        return "reminder.time-left." + code;
    }
}
