package com.giveawaybot.exception;

import lombok.Getter;

/**
 * The operation failed on a backing service and left nothing changed; it can be retried
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {

    private final long retryAfterSeconds;

    public ServiceUnavailableException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
