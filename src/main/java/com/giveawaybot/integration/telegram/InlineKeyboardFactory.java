package com.giveawaybot.integration.telegram;

import com.giveawaybot.config.I18nConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds inline keyboards as Bot API reply_markup objects
 */
@Component
@RequiredArgsConstructor
public class InlineKeyboardFactory {

    public static final String PARTICIPATE_PREFIX = "participate_";

    private final MessageSource messageSource;

    public Map<String, Object> participateKeyboard(Long giveawayId, long participantsCount) {
        String label = messageSource.getMessage("keyboard.participate",
                new Object[]{participantsCount}, I18nConfig.BOT_LOCALE);
        Map<String, Object> button = Map.of(
                "text", label,
                "callback_data", PARTICIPATE_PREFIX + giveawayId);
        return Map.of("inline_keyboard", List.of(List.of(button)));
    }
}
