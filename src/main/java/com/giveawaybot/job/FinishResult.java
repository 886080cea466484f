package com.giveawaybot.job;

import com.giveawaybot.domain.common.enums.DeliveryOutcome;
import com.giveawaybot.domain.giveaway.service.WinnerDraw;

import java.util.List;
import java.util.Map;

/**
 * Result of one finish run
 * @param notifications delivery outcome of each winner's direct message, by user id
 */
public record FinishResult(Long giveawayId,
                           FinishOutcome outcome,
                           List<WinnerDraw> winners,
                           Map<Long, DeliveryOutcome> notifications) {

    public static FinishResult skipped(Long giveawayId) {
        return new FinishResult(giveawayId, FinishOutcome.SKIPPED, List.of(), Map.of());
    }

    public static FinishResult failed(Long giveawayId) {
        return new FinishResult(giveawayId, FinishOutcome.FAILED, List.of(), Map.of());
    }
}
