package com.giveawaybot.integration.telegram;

import lombok.Getter;

/**
 * Error response of the Bot API ({"ok": false, "error_code": ..., "description": ...})
 */
@Getter
public class TelegramApiException extends RuntimeException {

    private final int errorCode;
    private final String description;
    /** Seconds to wait before retrying, present on 429 responses. */
    private final Integer retryAfter;

    public TelegramApiException(int errorCode, String description, Integer retryAfter) {
        super("Telegram API error " + errorCode + ": " + description);
        this.errorCode = errorCode;
        this.description = description;
        this.retryAfter = retryAfter;
    }
}
