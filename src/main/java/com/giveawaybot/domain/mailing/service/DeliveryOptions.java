package com.giveawaybot.domain.mailing.service;

import com.giveawaybot.config.GiveawayProperties.DeliveryProperties;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * Throttling settings of one bulk send
 */
@Getter
@Builder(toBuilder = true)
public class DeliveryOptions {

    private final Duration minDelay;
    private final Duration maxDelay;
    /** Extended pause after every N sends, 0 disables it. */
    private final int pauseEvery;
    private final Duration pauseMin;
    private final Duration pauseMax;
    private final int maxRetries;
    private final int progressEvery;
    private final Duration defaultRetryAfter;

    @Builder.Default
    private final boolean randomizeOrder = true;

    /** May be null. */
    private final DeliveryProgressListener progressListener;

    public static DeliveryOptions from(DeliveryProperties properties) {
        return DeliveryOptions.builder()
                .minDelay(properties.getMinDelay())
                .maxDelay(properties.getMaxDelay())
                .pauseEvery(properties.getPauseEvery())
                .pauseMin(properties.getPauseMin())
                .pauseMax(properties.getPauseMax())
                .maxRetries(properties.getMaxRetries())
                .progressEvery(properties.getProgressEvery())
                .defaultRetryAfter(properties.getDefaultRetryAfter())
                .build();
    }
}
