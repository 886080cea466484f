package com.giveawaybot.domain.common.enums;

import lombok.Getter;

/**
 * ACTIVE -> FINISHED on draw, ACTIVE -> CANCELLED on manual cancellation. Never back to ACTIVE.
 */
@Getter
public enum GiveawayStatus {
    ACTIVE("active"),
    FINISHED("finished"),
    CANCELLED("cancelled");

    private final String value;

    GiveawayStatus(String value) {
        this.value = value;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }
}
