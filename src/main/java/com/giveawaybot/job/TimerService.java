package com.giveawaybot.job;

import com.giveawaybot.config.GiveawayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timer Service
 * One-shot jobs keyed by name and fired at absolute instants on a dedicated thread pool.
 * Scheduling an existing key replaces the pending job, so a key never has two live jobs.
 */
@Slf4j
@Service
public class TimerService {

    private ScheduledExecutorService scheduler;
    private final Map<String, PendingJob> jobs = new ConcurrentHashMap<>();
    private final GiveawayProperties properties;
    private final Clock clock;

    public TimerService(GiveawayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        int poolSize = properties.getScheduler().getPoolSize();
        AtomicInteger threadCounter = new AtomicInteger();
        scheduler = Executors.newScheduledThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "giveaway-timer-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("TimerService initialized with {} worker threads", poolSize);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        jobs.clear();
        log.info("TimerService shutdown complete");
    }

    /**
     * Schedule a one-shot job, replacing any pending job with the same key.
     * A past-due instant fires as soon as a worker is free.
     */
    public void schedule(String key, String description, Instant fireAt, Runnable task) {
        jobs.compute(key, (k, existing) -> {
            if (existing != null) {
                existing.cancel();
                log.debug("Replacing job {}", key);
            }
            PendingJob job = new PendingJob(key, description, fireAt);
            long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
            job.future = scheduler.schedule(() -> execute(job, task), delayMs, TimeUnit.MILLISECONDS);
            return job;
        });
        log.debug("Scheduled job {} ({}) at {}", key, description, fireAt);
    }

    /**
     * @return false when no job was pending under the key
     */
    public boolean cancel(String key) {
        PendingJob job = jobs.remove(key);
        if (job == null) {
            return false;
        }
        job.cancel();
        log.debug("Cancelled job {}", key);
        return true;
    }

    public boolean isScheduled(String key) {
        return jobs.containsKey(key);
    }

    public TimerStatus status() {
        List<ScheduledJobInfo> pending = jobs.values().stream()
                .map(job -> new ScheduledJobInfo(job.key, job.description, job.fireAt))
                .sorted(Comparator.comparing(ScheduledJobInfo::nextFireTime))
                .toList();
        return new TimerStatus(isRunning(), pending.size(), pending);
    }

    public boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    private void execute(PendingJob job, Runnable task) {
        // A replaced or cancelled job no longer owns its key
        if (!jobs.remove(job.key, job)) {
            return;
        }
        try {
            log.debug("Executing job {} ({})", job.key, job.description);
            task.run();
        } catch (Exception e) {
            log.error("Error executing job {} ({}): {}", job.key, job.description, e.getMessage(), e);
        }
    }

    private static final class PendingJob {
        private final String key;
        private final String description;
        private final Instant fireAt;
        private volatile ScheduledFuture<?> future;

        private PendingJob(String key, String description, Instant fireAt) {
            this.key = key;
            this.description = description;
            this.fireAt = fireAt;
        }

        private void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
