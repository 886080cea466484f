package com.giveawaybot.domain.common.enums;

/**
 * Terminal result of one direct send. Classified once at the messaging boundary.
 */
public enum DeliveryOutcome {
    SUCCESS,
    /** Recipient blocked the sender, is deactivated or unreachable. Never retried. */
    BLOCKED,
    /** Throttled by Telegram; retried after the mandated wait up to the retry cap. */
    RATE_LIMITED,
    OTHER_ERROR;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
