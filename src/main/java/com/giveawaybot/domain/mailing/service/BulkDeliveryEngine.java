package com.giveawaybot.domain.mailing.service;

import com.giveawaybot.config.GiveawayProperties;
import com.giveawaybot.domain.common.enums.DeliveryOutcome;
import com.giveawaybot.integration.telegram.DirectMessenger;
import com.giveawaybot.integration.telegram.SendResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Throttled direct delivery to many users.
 * Runs on the caller's thread; callers put it on a background executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkDeliveryEngine {

    private final DirectMessenger directMessenger;
    private final Random random;
    private final Clock clock;
    private final Sleeper sleeper;
    private final GiveawayProperties properties;

    public DeliveryOptions defaultOptions() {
        return DeliveryOptions.from(properties.getDelivery());
    }

    /**
     * Sends the same text to every recipient. A user id listed more than once gets one message.
     */
    public DeliveryStats sendBulk(List<Long> recipients, String text, DeliveryOptions options, StopSignal stopSignal) {
        List<PersonalizedMessage> messages = recipients.stream()
                .distinct()
                .map(userId -> new PersonalizedMessage(userId, text))
                .toList();
        if (messages.size() < recipients.size()) {
            log.debug("Dropped {} duplicate recipients", recipients.size() - messages.size());
        }
        return deliver(messages, options, stopSignal);
    }

    /**
     * Sends a dedicated text to each recipient. Entries without a user id or text
     * count as attempted OTHER_ERROR sends and are not transmitted.
     * User ids must be unique: {@link DeliveryStats#getOutcomes()} keeps one outcome per user.
     */
    public DeliveryStats sendPersonalized(List<PersonalizedMessage> messages, DeliveryOptions options,
                                          StopSignal stopSignal) {
        return deliver(messages, options, stopSignal);
    }

    /**
     * Average inter-message delay per recipient plus the average extended pause per completed interval
     */
    public Duration estimateDeliveryTime(int recipientCount, DeliveryOptions options) {
        if (recipientCount <= 0) {
            return Duration.ZERO;
        }
        Duration averageDelay = options.getMinDelay().plus(options.getMaxDelay()).dividedBy(2);
        Duration estimate = averageDelay.multipliedBy(recipientCount);

        if (options.getPauseEvery() > 0) {
            Duration averagePause = options.getPauseMin().plus(options.getPauseMax()).dividedBy(2);
            estimate = estimate.plus(averagePause.multipliedBy(recipientCount / options.getPauseEvery()));
        }
        return estimate;
    }

    public Duration estimateDeliveryTime(int recipientCount) {
        return estimateDeliveryTime(recipientCount, defaultOptions());
    }

    private DeliveryStats deliver(List<PersonalizedMessage> messages, DeliveryOptions options, StopSignal stopSignal) {
        DeliveryStats stats = new DeliveryStats();
        stats.start(clock.instant());

        List<PersonalizedMessage> queue = new ArrayList<>(messages);
        if (options.isRandomizeOrder()) {
            Collections.shuffle(queue, random);
        }

        int total = queue.size();
        log.info("Starting delivery to {} recipients", total);

        for (int i = 0; i < total; i++) {
            if (stopSignal.isStopped() || Thread.currentThread().isInterrupted()) {
                stats.markStopped();
                log.info("Delivery stopped at {}/{}", i, total);
                break;
            }

            PersonalizedMessage message = queue.get(i);
            DeliveryOutcome outcome = deliverOne(message, options, stopSignal);
            stats.record(message.userId(), outcome);

            if (outcome != DeliveryOutcome.SUCCESS) {
                log.warn("Delivery to {} ended with {}", message.userId(), outcome);
            }

            int processed = i + 1;
            if (options.getProgressListener() != null && options.getProgressEvery() > 0
                    && processed % options.getProgressEvery() == 0) {
                notifyProgress(options.getProgressListener(), processed, total, stats);
            }

            if (processed < total && !pause(options, processed)) {
                stats.markStopped();
                log.info("Delivery interrupted at {}/{}", processed, total);
                break;
            }
        }

        stats.finish(clock.instant());
        log.info("Delivery finished: {}/{} successful, {} blocked, {} throttled, {} other errors",
                stats.getSuccessful(), stats.getTotalSent(), stats.getBlocked(),
                stats.getThrottled(), stats.getOtherErrors());
        return stats;
    }

    /**
     * Sends one message, retrying rate-limited attempts after the mandated wait.
     * An exhausted retry budget is reported as RATE_LIMITED.
     */
    private DeliveryOutcome deliverOne(PersonalizedMessage message, DeliveryOptions options, StopSignal stopSignal) {
        if (message.userId() == null || message.text() == null || message.text().isBlank()) {
            return DeliveryOutcome.OTHER_ERROR;
        }

        SendResult result = send(message);
        int retries = 0;
        while (result.outcome() == DeliveryOutcome.RATE_LIMITED
                && retries < options.getMaxRetries()
                && !stopSignal.isStopped()) {
            Duration wait = result.retryAfter() != null ? result.retryAfter() : options.getDefaultRetryAfter();
            log.warn("Rate limited sending to {}, retry {}/{} in {}s",
                    message.userId(), retries + 1, options.getMaxRetries(), wait.getSeconds());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            retries++;
            result = send(message);
        }
        return result.outcome();
    }

    private SendResult send(PersonalizedMessage message) {
        try {
            SendResult result = directMessenger.sendDirectMessage(message.userId(), message.text());
            return result != null ? result : SendResult.otherError("no result");
        } catch (RuntimeException e) {
            log.warn("Unexpected error sending to {}: {}", message.userId(), e.getMessage());
            return SendResult.otherError(e.getMessage());
        }
    }

    private void notifyProgress(DeliveryProgressListener listener, int processed, int total, DeliveryStats stats) {
        try {
            listener.onProgress(processed, total, stats);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}/{}: {}", processed, total, e.getMessage());
        }
    }

    /**
     * Random delay between sends plus the extended pause every pauseEvery sends
     * @return false when the thread was interrupted
     */
    private boolean pause(DeliveryOptions options, int processed) {
        try {
            sleeper.sleep(randomBetween(options.getMinDelay(), options.getMaxDelay()));
            if (options.getPauseEvery() > 0 && processed % options.getPauseEvery() == 0) {
                Duration extra = randomBetween(options.getPauseMin(), options.getPauseMax());
                log.debug("Extended pause of {}ms after {} sends", extra.toMillis(), processed);
                sleeper.sleep(extra);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Duration randomBetween(Duration min, Duration max) {
        long minMillis = min.toMillis();
        long maxMillis = max.toMillis();
        if (maxMillis <= minMillis) {
            return min;
        }
        return Duration.ofMillis(minMillis + (long) (random.nextDouble() * (maxMillis - minMillis)));
    }
}
