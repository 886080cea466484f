package com.giveawaybot.domain.common.enums;

public enum MailingStatus {
    PENDING,
    SENDING,
    DONE,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == FAILED;
    }
}
