package com.giveawaybot.domain.mailing.service;

public record PersonalizedMessage(Long userId, String text) {
}
