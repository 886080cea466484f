package com.giveawaybot.exception;

/**
 * The operation lost a race with a concurrent change of the same record
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
