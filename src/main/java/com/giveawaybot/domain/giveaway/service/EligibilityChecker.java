package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.domain.common.enums.MembershipStatus;
import com.giveawaybot.integration.telegram.BotMessenger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Live channel-membership check. Fails closed: a lookup error means not eligible.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EligibilityChecker {

    private final BotMessenger botMessenger;

    public boolean isEligible(Long userId, Long channelId) {
        try {
            MembershipStatus status = botMessenger.getChatMember(channelId, userId);
            return status.isSubscribed();
        } catch (Exception e) {
            log.warn("Subscription check of user {} in channel {} failed: {}", userId, channelId, e.getMessage());
            return false;
        }
    }
}
