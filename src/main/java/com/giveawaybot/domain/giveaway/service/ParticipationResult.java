package com.giveawaybot.domain.giveaway.service;

import lombok.Getter;

/**
 * Answer to a participate button press
 */
@Getter
public enum ParticipationResult {
    JOINED("callback.success", false),
    ALREADY_PARTICIPATING("callback.already-participating", false),
    GIVEAWAY_ENDED("callback.giveaway-ended", true),
    NOT_SUBSCRIBED("callback.not-subscribed", true);

    private final String messageKey;
    private final boolean alert;

    ParticipationResult(String messageKey, boolean alert) {
        this.messageKey = messageKey;
        this.alert = alert;
    }
}
