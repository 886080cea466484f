package com.giveawaybot.integration.telegram;

import com.giveawaybot.domain.common.enums.MembershipStatus;

import java.util.Map;

/**
 * Bot-side messaging: channel posts, membership lookups and callback answers.
 * Methods throw {@link TelegramApiException} on API errors.
 */
public interface BotMessenger {

    /**
     * Sends an HTML message
     * @param replyMarkup opaque reply_markup object, may be null
     * @param replyToMessageId message to reply to, may be null
     * @return id of the sent message
     */
    Long sendMessage(Long chatId, String text, Map<String, Object> replyMarkup, Long replyToMessageId);

    default Long sendMessage(Long chatId, String text) {
        return sendMessage(chatId, text, null, null);
    }

    MembershipStatus getChatMember(Long chatId, Long userId);

    void answerCallbackQuery(String callbackQueryId, String text, boolean showAlert);

    void editMessageReplyMarkup(Long chatId, Long messageId, Map<String, Object> replyMarkup);

    /**
     * Replaces the HTML text of a sent message, keeping or replacing its keyboard
     */
    void editMessageText(Long chatId, Long messageId, String text, Map<String, Object> replyMarkup);
}
