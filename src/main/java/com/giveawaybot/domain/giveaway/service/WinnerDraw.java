package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.domain.giveaway.entity.Participant;

/**
 * Participant drawn into a prize place (1-based)
 */
public record WinnerDraw(Participant participant, int place) {

    public Long userId() {
        return participant.getUserId();
    }
}
