package com.giveawaybot.integration.telegram;

import com.giveawaybot.domain.common.enums.DeliveryOutcome;

import java.time.Duration;

/**
 * Outcome of one direct send
 * @param retryAfter wait mandated by Telegram, only for RATE_LIMITED and may be null
 */
public record SendResult(DeliveryOutcome outcome, Duration retryAfter, String description) {

    public static SendResult success() {
        return new SendResult(DeliveryOutcome.SUCCESS, null, null);
    }

    public static SendResult blocked(String description) {
        return new SendResult(DeliveryOutcome.BLOCKED, null, description);
    }

    public static SendResult rateLimited(Duration retryAfter, String description) {
        return new SendResult(DeliveryOutcome.RATE_LIMITED, retryAfter, description);
    }

    public static SendResult otherError(String description) {
        return new SendResult(DeliveryOutcome.OTHER_ERROR, null, description);
    }

    public boolean isSuccess() {
        return outcome == DeliveryOutcome.SUCCESS;
    }
}
