package com.giveawaybot.domain.common.enums;

import lombok.Getter;

/**
 * Which channel subscribers a mailing goes to
 */
@Getter
public enum AudienceType {
    ALL(0),
    ACTIVE_30D(30);

    /** Activity window in days, 0 means no activity filter. */
    private final int activeDays;

    AudienceType(int activeDays) {
        this.activeDays = activeDays;
    }
}
