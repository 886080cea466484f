package com.giveawaybot.integration.telegram;

/**
 * Direct messages to individual users. Never throws: every failure is classified into a {@link SendResult}.
 */
public interface DirectMessenger {

    SendResult sendDirectMessage(Long userId, String text);
}
