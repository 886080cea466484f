package com.giveawaybot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed settings under giveaway.* (timer pool, retention, reminders, delivery throttling)
 */
@ConfigurationProperties(prefix = "giveaway")
@Getter
@Setter
public class GiveawayProperties {

    private SchedulerProperties scheduler = new SchedulerProperties();
    private CleanupProperties cleanup = new CleanupProperties();
    private ReminderProperties reminders = new ReminderProperties();
    private DeliveryProperties delivery = new DeliveryProperties();

    @Getter
    @Setter
    public static class SchedulerProperties {
        /** Worker threads of the timer service. */
        private int poolSize = 4;
    }

    @Getter
    @Setter
    public static class CleanupProperties {
        /** Finished giveaways older than this many days are deleted. */
        private int retentionDays = 15;
    }

    @Getter
    @Setter
    public static class ReminderProperties {
        private boolean enabledByDefault = true;
    }

    @Getter
    @Setter
    public static class DeliveryProperties {
        private Duration minDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(3);
        /** Extended pause after every N sends. */
        private int pauseEvery = 50;
        private Duration pauseMin = Duration.ofSeconds(10);
        private Duration pauseMax = Duration.ofSeconds(20);
        private int maxRetries = 3;
        private int progressEvery = 10;
        /** Used when a 429 response carries no retry_after. */
        private Duration defaultRetryAfter = Duration.ofSeconds(30);
    }
}
