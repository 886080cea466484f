package com.giveawaybot.integration.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.giveawaybot.config.I18nConfig;
import com.giveawaybot.domain.channel.service.ChannelService;
import com.giveawaybot.domain.common.enums.MembershipStatus;
import com.giveawaybot.domain.giveaway.service.GiveawayManagementService;
import com.giveawaybot.domain.giveaway.service.ParticipationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Service;

/**
 * Telegram Update Service
 * Dispatches webhook updates: participate buttons, channel membership changes, discussion comments
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramUpdateService {

    private final GiveawayManagementService managementService;
    private final ChannelService channelService;
    private final BotMessenger botMessenger;
    private final MessageSource messageSource;

    public void processUpdate(JsonNode update) {
        if (update.hasNonNull("callback_query")) {
            handleCallbackQuery(update.get("callback_query"));
        } else if (update.hasNonNull("chat_member")) {
            handleChatMember(update.get("chat_member"));
        } else if (update.hasNonNull("message")) {
            handleGroupMessage(update.get("message"));
        } else {
            log.debug("Ignoring update {}", update.path("update_id").asLong());
        }
    }

    void handleCallbackQuery(JsonNode callbackQuery) {
        String callbackId = callbackQuery.path("id").asText();
        String data = callbackQuery.path("data").asText("");
        if (!data.startsWith(InlineKeyboardFactory.PARTICIPATE_PREFIX)) {
            log.debug("Unhandled callback data {}", data);
            return;
        }

        JsonNode from = callbackQuery.path("from");
        long userId = from.path("id").asLong();
        try {
            Long giveawayId = Long.valueOf(data.substring(InlineKeyboardFactory.PARTICIPATE_PREFIX.length()));
            ParticipationResult result = managementService.participate(giveawayId, userId,
                    textOrNull(from, "username"), textOrNull(from, "first_name"), fullName(from));
            answer(callbackId, result.getMessageKey(), result.isAlert());
        } catch (Exception e) {
            log.error("Error handling participation of user {} ({}): {}", userId, data, e.getMessage(), e);
            answer(callbackId, "callback.error", true);
        }
    }

    /**
     * Channel subscriptions: left/kicked -> member/restricted is a join, the reverse is a leave
     */
    void handleChatMember(JsonNode chatMember) {
        JsonNode chat = chatMember.path("chat");
        if (!"channel".equals(chat.path("type").asText())) {
            return;
        }

        long channelId = chat.path("id").asLong();
        JsonNode user = chatMember.path("new_chat_member").path("user");
        long userId = user.path("id").asLong();

        MembershipStatus oldStatus;
        MembershipStatus newStatus;
        try {
            oldStatus = MembershipStatus.fromApiValue(chatMember.path("old_chat_member").path("status").asText(null));
            newStatus = MembershipStatus.fromApiValue(chatMember.path("new_chat_member").path("status").asText(null));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown membership status in channel {}: {}", channelId, e.getMessage());
            return;
        }

        if (oldStatus.isGone() && newStatus.isPresent()) {
            channelService.recordJoin(channelId, userId,
                    textOrNull(user, "username"), textOrNull(user, "first_name"), fullName(user));
        } else if (oldStatus.isPresent() && newStatus.isGone()) {
            channelService.recordLeave(channelId, userId);
        }
    }

    /**
     * A reply in a linked discussion group counts as subscriber activity
     */
    void handleGroupMessage(JsonNode message) {
        String chatType = message.path("chat").path("type").asText();
        if (!"supergroup".equals(chatType) && !"group".equals(chatType)) {
            return;
        }
        if (!message.hasNonNull("reply_to_message") && !message.path("is_topic_message").asBoolean(false)) {
            return;
        }

        JsonNode user = message.path("from");
        if (user.path("is_bot").asBoolean(false)) {
            return;
        }
        long groupId = message.path("chat").path("id").asLong();
        boolean recorded = channelService.recordActivity(groupId, user.path("id").asLong(),
                textOrNull(user, "username"), textOrNull(user, "first_name"), fullName(user));
        if (recorded) {
            log.debug("Activity of user {} in discussion group {}", user.path("id").asLong(), groupId);
        }
    }

    private void answer(String callbackId, String messageKey, boolean alert) {
        try {
            String text = messageSource.getMessage(messageKey, null, I18nConfig.BOT_LOCALE);
            botMessenger.answerCallbackQuery(callbackId, text, alert);
        } catch (Exception e) {
            log.warn("Could not answer callback {}: {}", callbackId, e.getMessage());
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String fullName(JsonNode user) {
        String first = textOrNull(user, "first_name");
        String last = textOrNull(user, "last_name");
        if (first == null) {
            return last;
        }
        return last == null ? first : first + " " + last;
    }
}
