package com.giveawaybot.domain.common.enums;

import lombok.Getter;

import java.util.Locale;

/**
 * Chat member status as reported by getChatMember
 */
@Getter
public enum MembershipStatus {
    CREATOR("creator"),
    ADMINISTRATOR("administrator"),
    MEMBER("member"),
    RESTRICTED("restricted"),
    LEFT("left"),
    KICKED("kicked");

    private final String apiValue;

    MembershipStatus(String apiValue) {
        this.apiValue = apiValue;
    }

    /**
     * Statuses that qualify a participant for a draw
     */
    public boolean isSubscribed() {
        return this == CREATOR || this == ADMINISTRATOR || this == MEMBER;
    }

    /**
     * Present in the channel for subscriber tracking (restricted users still count as joined)
     */
    public boolean isPresent() {
        return this == MEMBER || this == RESTRICTED;
    }

    public boolean isGone() {
        return this == LEFT || this == KICKED;
    }

    public static MembershipStatus fromApiValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Chat member status is missing");
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        // "owner" is accepted as an alias of creator
        if ("owner".equals(normalized)) {
            return CREATOR;
        }
        for (MembershipStatus status : values()) {
            if (status.apiValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown chat member status: " + value);
    }
}
