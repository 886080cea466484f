package com.giveawaybot.api.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.giveawaybot.integration.telegram.TelegramUpdateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Telegram Webhook Controller
 * Receives bot updates pushed by Telegram
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class TelegramWebhookController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TelegramUpdateService updateService;

    @Value("${telegram.webhook-secret:}")
    private String webhookSecret;

    @PostMapping("/telegram/webhook")
    public ResponseEntity<String> handleUpdate(
            @RequestHeader(name = SECRET_HEADER, required = false) String secret,
            @RequestBody JsonNode update) {

        if (!webhookSecret.isEmpty() && !webhookSecret.equals(secret)) {
            log.warn("Telegram webhook called with an invalid secret token");
            return ResponseEntity.status(403).body("Forbidden");
        }

        try {
            updateService.processUpdate(update);
        } catch (Exception e) {
            // 200 anyway so Telegram does not redeliver the update
            log.error("Error processing Telegram update {}: {}", update.path("update_id").asLong(), e.getMessage(), e);
        }
        return ResponseEntity.ok("OK");
    }
}
