package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.domain.common.enums.MembershipStatus;
import com.giveawaybot.integration.telegram.BotMessenger;
import com.giveawaybot.integration.telegram.TelegramApiException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EligibilityCheckerTest {

    private static final Long CHANNEL_ID = -1001234L;

    @Mock
    private BotMessenger botMessenger;

    @InjectMocks
    private EligibilityChecker eligibilityChecker;

    @Test
    void isEligible_Member_ReturnsTrue() {
        when(botMessenger.getChatMember(CHANNEL_ID, 1L)).thenReturn(MembershipStatus.MEMBER);

        assertTrue(eligibilityChecker.isEligible(1L, CHANNEL_ID));
    }

    @Test
    void isEligible_AdministratorOrCreator_ReturnsTrue() {
        when(botMessenger.getChatMember(CHANNEL_ID, 1L)).thenReturn(MembershipStatus.ADMINISTRATOR);
        when(botMessenger.getChatMember(CHANNEL_ID, 2L)).thenReturn(MembershipStatus.CREATOR);

        assertTrue(eligibilityChecker.isEligible(1L, CHANNEL_ID));
        assertTrue(eligibilityChecker.isEligible(2L, CHANNEL_ID));
    }

    @Test
    void isEligible_LeftKickedOrRestricted_ReturnsFalse() {
        when(botMessenger.getChatMember(CHANNEL_ID, 1L)).thenReturn(MembershipStatus.LEFT);
        when(botMessenger.getChatMember(CHANNEL_ID, 2L)).thenReturn(MembershipStatus.KICKED);
        when(botMessenger.getChatMember(CHANNEL_ID, 3L)).thenReturn(MembershipStatus.RESTRICTED);

        assertFalse(eligibilityChecker.isEligible(1L, CHANNEL_ID));
        assertFalse(eligibilityChecker.isEligible(2L, CHANNEL_ID));
        assertFalse(eligibilityChecker.isEligible(3L, CHANNEL_ID));
    }

    @Test
    void isEligible_ApiError_FailsClosed() {
        when(botMessenger.getChatMember(CHANNEL_ID, 1L))
                .thenThrow(new TelegramApiException(400, "Bad Request: user not found", null));

        assertFalse(eligibilityChecker.isEligible(1L, CHANNEL_ID));
    }

    @Test
    void isEligible_UnexpectedError_FailsClosed() {
        when(botMessenger.getChatMember(CHANNEL_ID, 1L)).thenThrow(new IllegalStateException("timeout"));

        assertFalse(eligibilityChecker.isEligible(1L, CHANNEL_ID));
    }
}
