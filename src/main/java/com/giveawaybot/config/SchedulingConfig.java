package com.giveawaybot.config;

import com.giveawaybot.domain.mailing.service.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Time and randomness sources shared by the scheduler, the winner draw and bulk delivery.
 * Tests replace them with fixed clocks, seeded randoms and no-op sleepers.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random() {
        return new SecureRandom();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
