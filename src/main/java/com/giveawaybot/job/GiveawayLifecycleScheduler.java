package com.giveawaybot.job;

import com.giveawaybot.config.GiveawayProperties;
import com.giveawaybot.domain.channel.entity.Channel;
import com.giveawaybot.domain.channel.service.ChannelService;
import com.giveawaybot.domain.common.enums.DeliveryOutcome;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.domain.giveaway.entity.Participant;
import com.giveawaybot.domain.giveaway.service.EligibilityChecker;
import com.giveawaybot.domain.giveaway.service.GiveawayMessageRenderer;
import com.giveawaybot.domain.giveaway.service.GiveawayService;
import com.giveawaybot.domain.giveaway.service.WinnerDraw;
import com.giveawaybot.domain.giveaway.service.WinnerSelector;
import com.giveawaybot.domain.mailing.service.BulkDeliveryEngine;
import com.giveawaybot.domain.mailing.service.DeliveryOptions;
import com.giveawaybot.domain.mailing.service.DeliveryStats;
import com.giveawaybot.domain.mailing.service.PersonalizedMessage;
import com.giveawaybot.domain.mailing.service.StopSignal;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.integration.telegram.BotMessenger;
import com.giveawaybot.integration.telegram.InlineKeyboardFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Giveaway Lifecycle Scheduler
 * Owns the finish and reminder jobs of every active giveaway and the reminder flags.
 *
 * Finish order: re-check active, filter by live membership, draw, persist, then announce and notify.
 * Persisted winners are final; announcement and notification failures are only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayLifecycleScheduler {

    static final String FINISH_KEY_PREFIX = "finish_giveaway_";
    static final String REMINDER_KEY_PREFIX = "reminder_";

    private final TimerService timerService;
    private final GiveawayService giveawayService;
    private final ChannelService channelService;
    private final EligibilityChecker eligibilityChecker;
    private final WinnerSelector winnerSelector;
    private final BulkDeliveryEngine deliveryEngine;
    private final BotMessenger botMessenger;
    private final GiveawayMessageRenderer renderer;
    private final InlineKeyboardFactory keyboardFactory;
    private final GiveawayProperties properties;
    private final Clock clock;

    private final Map<Long, ReminderState> reminderStates = new ConcurrentHashMap<>();

    @Value("${telegram.main-admin-id:#{null}}")
    private Long mainAdminId;

    /**
     * Rebuild schedules from persisted active giveaways. Reminder flags start unfired;
     * tiers already in the past are skipped and overdue giveaways are finished right away.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restoreSchedules() {
        try {
            List<Giveaway> active = giveawayService.getActiveGiveaways();
            for (Giveaway giveaway : active) {
                scheduleGiveaway(giveaway);
            }
            log.info("Restored schedules of {} active giveaways", active.size());
        } catch (Exception e) {
            log.error("Error restoring giveaway schedules: {}", e.getMessage(), e);
        }
    }

    /**
     * Schedule the finish job and, if enabled, the reminder cascade
     */
    public void scheduleGiveaway(Giveaway giveaway) {
        ReminderState state = reminderStates.computeIfAbsent(giveaway.getId(),
                id -> new ReminderState(properties.getReminders().isEnabledByDefault()));

        scheduleFinish(giveaway);
        if (state.isEnabled()) {
            scheduleReminders(giveaway);
        }
    }

    /**
     * Re-arm the jobs of a giveaway whose end time changed. Jobs are replaced under their keys;
     * reminder flags start over for the new end time and keep their enabled setting.
     */
    public void rescheduleGiveaway(Giveaway giveaway) {
        Long giveawayId = giveaway.getId();
        ReminderState state = reminderStates.compute(giveawayId, (id, current) -> new ReminderState(
                current != null ? current.isEnabled() : properties.getReminders().isEnabledByDefault()));

        cancelReminderJobs(giveawayId);
        scheduleFinish(giveaway);
        if (state.isEnabled()) {
            scheduleReminders(giveaway);
        }
        log.info("Rescheduled giveaway {} to end at {}", giveawayId, giveaway.getEndInstant());
    }

    public void scheduleFinish(Giveaway giveaway) {
        Long giveawayId = giveaway.getId();
        Instant now = clock.instant();
        Instant fireAt = giveaway.getEndInstant();
        if (fireAt.isBefore(now)) {
            log.warn("Giveaway {} ended at {} while not running, finishing now", giveawayId, fireAt);
            fireAt = now;
        }

        timerService.schedule(finishKey(giveawayId), "Finish giveaway #" + giveawayId, fireAt,
                () -> finishGiveaway(giveawayId));
        log.info("Scheduled finish of giveaway {} at {}", giveawayId, fireAt);
    }

    /**
     * @return number of reminder jobs scheduled; tiers in the past or already fired are skipped
     */
    public int scheduleReminders(Giveaway giveaway) {
        Long giveawayId = giveaway.getId();
        ReminderState state = reminderStates.get(giveawayId);
        if (state == null || !state.isEnabled()) {
            return 0;
        }

        Instant now = clock.instant();
        int scheduled = 0;
        for (ReminderTier tier : ReminderTier.values()) {
            Instant fireAt = tier.fireTime(giveaway.getEndInstant());
            if (!fireAt.isAfter(now) || state.hasFired(tier)) {
                continue;
            }
            timerService.schedule(reminderKey(tier, giveawayId),
                    "Reminder " + tier.getCode() + " for giveaway #" + giveawayId, fireAt,
                    () -> sendReminder(giveawayId, tier));
            scheduled++;
        }
        log.debug("Scheduled {} reminders for giveaway {}", scheduled, giveawayId);
        return scheduled;
    }

    /**
     * Post one reminder to the channel
     * @return true when the reminder was posted by this call
     */
    public boolean sendReminder(Long giveawayId, ReminderTier tier) {
        ReminderState state = reminderStates.get(giveawayId);
        if (state == null || !state.isEnabled()) {
            return false;
        }

        Giveaway giveaway = giveawayService.findGiveaway(giveawayId).orElse(null);
        if (giveaway == null || !giveaway.isActive()) {
            return false;
        }
        if (!giveaway.getEndInstant().isAfter(clock.instant())) {
            return false;
        }
        if (!state.tryClaim(tier)) {
            return false;
        }

        try {
            long participants = giveawayService.getParticipantsCount(giveawayId);
            botMessenger.sendMessage(giveaway.getChannelId(),
                    renderer.renderReminder(giveaway, tier, participants),
                    keyboardFactory.participateKeyboard(giveawayId, participants),
                    null);
            log.info("Sent reminder {} for giveaway {}", tier.getCode(), giveawayId);
            return true;
        } catch (Exception e) {
            state.release(tier);
            log.error("Error sending reminder {} for giveaway {}: {}", tier.getCode(), giveawayId, e.getMessage());
            return false;
        }
    }

    /**
     * Turn reminders off and drop their pending jobs
     */
    public void disableReminders(Long giveawayId) {
        requireActive(giveawayId);
        reminderStates.computeIfPresent(giveawayId, (id, state) -> {
            state.setEnabled(false);
            return state;
        });
        cancelReminderJobs(giveawayId);
        log.info("Reminders disabled for giveaway {}", giveawayId);
    }

    /**
     * Turn reminders back on and schedule the tiers that have not fired and are still ahead
     */
    public int enableReminders(Long giveawayId) {
        Giveaway giveaway = requireActive(giveawayId);
        ReminderState state = reminderStates.computeIfPresent(giveawayId, (id, current) -> {
            current.setEnabled(true);
            return current;
        });
        if (state == null) {
            throw new BusinessException("Giveaway " + giveawayId + " has no schedule");
        }
        int scheduled = scheduleReminders(giveaway);
        log.info("Reminders enabled for giveaway {}", giveawayId);
        return scheduled;
    }

    /**
     * Cancel the finish job and every reminder job and forget the reminder flags.
     * Called before a giveaway is cancelled or deleted.
     */
    public void cancelGiveawaySchedule(Long giveawayId) {
        reminderStates.remove(giveawayId);
        if (timerService.cancel(finishKey(giveawayId))) {
            log.info("Cancelled automatic finish of giveaway {}", giveawayId);
        }
        cancelReminderJobs(giveawayId);
    }

    /**
     * Finish a giveaway. Safe to call more than once: only the run that closes
     * the active giveaway draws winners and announces them.
     */
    public FinishResult finishGiveaway(Long giveawayId) {
        Giveaway giveaway = giveawayService.findGiveaway(giveawayId).orElse(null);
        if (giveaway == null || !giveaway.isActive()) {
            log.info("Giveaway {} is missing or not active, finish skipped", giveawayId);
            return FinishResult.skipped(giveawayId);
        }

        List<Participant> participants = giveawayService.getParticipants(giveawayId);
        List<Participant> eligible = participants.stream()
                .filter(p -> eligibilityChecker.isEligible(p.getUserId(), giveaway.getChannelId()))
                .toList();
        log.info("Giveaway {}: {} of {} participants are eligible", giveawayId, eligible.size(), participants.size());

        List<WinnerDraw> draws = winnerSelector.selectWinners(eligible, giveaway.getWinnerPlaces());

        boolean closed;
        try {
            closed = giveawayService.finishGiveaway(giveawayId, draws);
        } catch (Exception e) {
            log.error("Failed to persist finish of giveaway {}, it stays active: {}", giveawayId, e.getMessage(), e);
            return FinishResult.failed(giveawayId);
        }
        if (!closed) {
            return FinishResult.skipped(giveawayId);
        }
        cancelGiveawaySchedule(giveawayId);

        if (draws.isEmpty()) {
            announce(giveaway, renderer.renderNoParticipants());
            reportToAdmin(giveaway, participants.size(), 0, draws, Map.of());
            log.info("Giveaway {} finished without participants", giveawayId);
            return new FinishResult(giveawayId, FinishOutcome.NO_PARTICIPANTS, draws, Map.of());
        }

        announce(giveaway, renderer.renderWinnersAnnouncement(draws));
        Map<Long, DeliveryOutcome> notifications = notifyWinners(giveaway, draws);
        reportToAdmin(giveaway, participants.size(), eligible.size(), draws, notifications);

        log.info("Giveaway {} finished, results published", giveawayId);
        return new FinishResult(giveawayId, FinishOutcome.FINISHED, draws, notifications);
    }

    /**
     * Delete finished giveaways past the retention window (daily)
     */
    @Scheduled(cron = "${giveaway.cleanup.cron:0 0 4 * * *}", zone = "UTC")
    public void cleanupFinishedGiveaways() {
        int days = properties.getCleanup().getRetentionDays();
        try {
            int deleted = giveawayService.deleteFinishedOlderThan(days);
            if (deleted > 0) {
                log.info("Cleaned up {} finished giveaways older than {} days", deleted, days);
            }
        } catch (Exception e) {
            log.error("Error cleaning up finished giveaways: {}", e.getMessage(), e);
        }
    }

    public Optional<ReminderState> getReminderState(Long giveawayId) {
        return Optional.ofNullable(reminderStates.get(giveawayId));
    }

    public Map<Long, ReminderState> getReminderStates() {
        return Collections.unmodifiableMap(reminderStates);
    }

    public TimerStatus status() {
        return timerService.status();
    }

    static String finishKey(Long giveawayId) {
        return FINISH_KEY_PREFIX + giveawayId;
    }

    static String reminderKey(ReminderTier tier, Long giveawayId) {
        return REMINDER_KEY_PREFIX + tier.getCode() + "_" + giveawayId;
    }

    private Giveaway requireActive(Long giveawayId) {
        Giveaway giveaway = giveawayService.getGiveaway(giveawayId);
        if (!giveaway.isActive()) {
            throw new BusinessException("Giveaway is already " + giveaway.getStatus().getValue());
        }
        return giveaway;
    }

    private void cancelReminderJobs(Long giveawayId) {
        for (ReminderTier tier : ReminderTier.values()) {
            timerService.cancel(reminderKey(tier, giveawayId));
        }
    }

    private void announce(Giveaway giveaway, String text) {
        try {
            botMessenger.sendMessage(giveaway.getChannelId(), text, null, giveaway.getMessageId());
        } catch (Exception e) {
            log.error("Error announcing results of giveaway {}: {}", giveaway.getId(), e.getMessage());
        }
    }

    private Map<Long, DeliveryOutcome> notifyWinners(Giveaway giveaway, List<WinnerDraw> draws) {
        List<PersonalizedMessage> messages = draws.stream()
                .map(draw -> new PersonalizedMessage(draw.userId(), renderer.renderWinnerMessage(giveaway, draw.place())))
                .toList();
        try {
            DeliveryOptions options = deliveryEngine.defaultOptions().toBuilder()
                    .randomizeOrder(false)
                    .build();
            DeliveryStats stats = deliveryEngine.sendPersonalized(messages, options, new StopSignal());
            log.info("Giveaway {}: notified {}/{} winners", giveaway.getId(), stats.getSuccessful(), draws.size());
            return stats.getOutcomes();
        } catch (Exception e) {
            log.error("Error notifying winners of giveaway {}: {}", giveaway.getId(), e.getMessage(), e);
            return Map.of();
        }
    }

    private void reportToAdmin(Giveaway giveaway, int participantsCount, int eligibleCount,
                               List<WinnerDraw> draws, Map<Long, DeliveryOutcome> notifications) {
        Long adminId = resolveAdminId(giveaway);
        if (adminId == null) {
            log.warn("No admin to report giveaway {} to", giveaway.getId());
            return;
        }
        try {
            botMessenger.sendMessage(adminId, renderer.renderAdminSummary(
                    giveaway, participantsCount, eligibleCount, draws, notifications));
        } catch (Exception e) {
            log.warn("Could not send summary of giveaway {} to admin {}: {}", giveaway.getId(), adminId, e.getMessage());
        }
    }

    private Long resolveAdminId(Giveaway giveaway) {
        Long channelAdmin = channelService.findChannel(giveaway.getChannelId())
                .map(Channel::getAddedBy)
                .orElse(null);
        if (channelAdmin != null) {
            return channelAdmin;
        }
        return giveaway.getCreatedBy() != null ? giveaway.getCreatedBy() : mainAdminId;
    }
}
