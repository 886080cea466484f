package com.giveawaybot.integration.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.giveawaybot.domain.common.enums.MembershipStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Telegram Bot API client.
 * Also serves as the direct-notify channel: the bot can message every user who has started it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramBotApiClient implements BotMessenger, DirectMessenger {

    private final WebClient.Builder webClientBuilder;

    @Value("${telegram.base-url:https://api.telegram.org}")
    private String baseUrl;

    @Value("${telegram.bot-token:}")
    private String botToken;

    @Value("${telegram.request-timeout:PT30S}")
    private Duration requestTimeout;

    @Override
    public Long sendMessage(Long chatId, String text, Map<String, Object> replyMarkup, Long replyToMessageId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        payload.put("parse_mode", "HTML");
        if (replyMarkup != null) {
            payload.put("reply_markup", replyMarkup);
        }
        if (replyToMessageId != null) {
            payload.put("reply_parameters", Map.of(
                    "message_id", replyToMessageId,
                    "allow_sending_without_reply", true));
        }

        JsonNode result = call("sendMessage", payload);
        return result.path("message_id").asLong();
    }

    @Override
    public MembershipStatus getChatMember(Long chatId, Long userId) {
        JsonNode result = call("getChatMember", Map.of("chat_id", chatId, "user_id", userId));
        return MembershipStatus.fromApiValue(result.path("status").asText(null));
    }

    @Override
    public void answerCallbackQuery(String callbackQueryId, String text, boolean showAlert) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("callback_query_id", callbackQueryId);
        payload.put("text", text);
        payload.put("show_alert", showAlert);
        call("answerCallbackQuery", payload);
    }

    @Override
    public void editMessageReplyMarkup(Long chatId, Long messageId, Map<String, Object> replyMarkup) {
        call("editMessageReplyMarkup", Map.of(
                "chat_id", chatId,
                "message_id", messageId,
                "reply_markup", replyMarkup));
    }

    @Override
    public void editMessageText(Long chatId, Long messageId, String text, Map<String, Object> replyMarkup) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("chat_id", chatId);
        payload.put("message_id", messageId);
        payload.put("text", text);
        payload.put("parse_mode", "HTML");
        if (replyMarkup != null) {
            payload.put("reply_markup", replyMarkup);
        }
        call("editMessageText", payload);
    }

    @Override
    public SendResult sendDirectMessage(Long userId, String text) {
        try {
            sendMessage(userId, text, null, null);
            return SendResult.success();
        } catch (TelegramApiException e) {
            return classify(e);
        } catch (Exception e) {
            log.warn("Direct message to {} failed: {}", userId, e.getMessage());
            return SendResult.otherError(e.getMessage());
        }
    }

    /**
     * Maps a Bot API error to a delivery outcome
     */
    static SendResult classify(TelegramApiException e) {
        String description = e.getDescription() != null ? e.getDescription() : "";
        String lower = description.toLowerCase(Locale.ROOT);

        if (e.getErrorCode() == 429) {
            Duration retryAfter = e.getRetryAfter() != null ? Duration.ofSeconds(e.getRetryAfter()) : null;
            return SendResult.rateLimited(retryAfter, description);
        }
        if (e.getErrorCode() == 403
                || lower.contains("user is deactivated")
                || lower.contains("chat not found")) {
            return SendResult.blocked(description);
        }
        return SendResult.otherError(description);
    }

    private JsonNode call(String method, Map<String, Object> payload) {
        String url = String.format("%s/bot%s/%s", baseUrl, botToken, method);

        TelegramResponse response = webClientBuilder.build()
                .post()
                .uri(url)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse -> clientResponse
                        .bodyToMono(TelegramResponse.class)
                        .map(TelegramResponse::toException)
                        .switchIfEmpty(Mono.fromSupplier(() -> new TelegramApiException(
                                clientResponse.statusCode().value(), "empty error response", null))))
                .bodyToMono(TelegramResponse.class)
                .timeout(requestTimeout)
                .block();

        if (response == null) {
            throw new TelegramApiException(0, "empty response to " + method, null);
        }
        if (!response.ok()) {
            throw response.toException();
        }
        log.debug("Telegram {} succeeded", method);
        return response.result();
    }

    public record TelegramResponse(
            boolean ok,
            JsonNode result,
            Integer error_code,
            String description,
            ResponseParameters parameters
    ) {
        public record ResponseParameters(Integer retry_after, Long migrate_to_chat_id) {}

        TelegramApiException toException() {
            return new TelegramApiException(
                    error_code != null ? error_code : 0,
                    description,
                    parameters != null ? parameters.retry_after() : null);
        }
    }
}
