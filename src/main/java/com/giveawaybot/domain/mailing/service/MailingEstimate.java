package com.giveawaybot.domain.mailing.service;

import com.giveawaybot.domain.common.enums.AudienceType;

import java.time.Duration;

public record MailingEstimate(Long channelId, AudienceType audienceType, int recipients, Duration duration) {
}
