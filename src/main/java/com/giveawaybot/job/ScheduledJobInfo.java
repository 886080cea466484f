package com.giveawaybot.job;

import java.time.Instant;

public record ScheduledJobInfo(String key, String description, Instant nextFireTime) {
}
