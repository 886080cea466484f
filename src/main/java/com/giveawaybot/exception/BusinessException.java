package com.giveawaybot.exception;

/**
 * Rejected administrator input or an operation not allowed in the current state
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
