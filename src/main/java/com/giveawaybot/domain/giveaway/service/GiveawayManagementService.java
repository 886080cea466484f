package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.domain.channel.service.ChannelService;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.exception.ConflictException;
import com.giveawaybot.exception.ServiceUnavailableException;
import com.giveawaybot.integration.telegram.BotMessenger;
import com.giveawaybot.integration.telegram.InlineKeyboardFactory;
import com.giveawaybot.integration.telegram.TelegramApiException;
import com.giveawaybot.job.FinishOutcome;
import com.giveawaybot.job.FinishResult;
import com.giveawaybot.job.GiveawayLifecycleScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Giveaway operations that span persistence, the channel post and the lifecycle schedule
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayManagementService {

    private static final long FINISH_RETRY_AFTER_SECONDS = 30;

    private final GiveawayService giveawayService;
    private final ChannelService channelService;
    private final GiveawayLifecycleScheduler lifecycleScheduler;
    private final EligibilityChecker eligibilityChecker;
    private final BotMessenger botMessenger;
    private final InlineKeyboardFactory keyboardFactory;
    private final GiveawayMessageRenderer renderer;
    private final Clock clock;

    /**
     * Create a giveaway, publish its post with the participate button and schedule finish and reminders.
     * A giveaway whose post cannot be published is removed again.
     */
    public Giveaway createGiveaway(String title, String description, String messageWinner,
                                   Long channelId, LocalDateTime endTime, int winnerPlaces, Long createdBy) {
        channelService.getChannel(channelId);

        Giveaway giveaway = giveawayService.createGiveaway(
                title, description, messageWinner, channelId, endTime, winnerPlaces, createdBy);

        try {
            Long messageId = botMessenger.sendMessage(channelId,
                    renderer.renderGiveawayPost(giveaway),
                    keyboardFactory.participateKeyboard(giveaway.getId(), 0),
                    null);
            giveawayService.updateMessageId(giveaway.getId(), messageId);
            giveaway.setMessageId(messageId);
        } catch (RuntimeException e) {
            log.error("Could not publish giveaway {} to channel {}: {}", giveaway.getId(), channelId, e.getMessage());
            giveawayService.deleteGiveaway(giveaway.getId());
            String reason = e instanceof TelegramApiException ? ((TelegramApiException) e).getDescription() : e.getMessage();
            throw new BusinessException("Could not publish the giveaway to channel " + channelId + ": " + reason);
        }

        lifecycleScheduler.scheduleGiveaway(giveaway);
        log.info("Giveaway {} published in channel {} as message {}", giveaway.getId(), channelId, giveaway.getMessageId());
        return giveaway;
    }

    /**
     * Edit an active giveaway. A new end time re-arms its finish and reminder jobs;
     * the channel post is updated to match.
     */
    public Giveaway updateGiveaway(Long giveawayId, String title, String description, String messageWinner,
                                   LocalDateTime endTime, Integer winnerPlaces) {
        Giveaway before = giveawayService.getGiveaway(giveawayId);
        boolean endTimeChanged = endTime != null && !endTime.equals(before.getEndTime());

        Giveaway updated = giveawayService.updateGiveaway(
                giveawayId, title, description, messageWinner, endTime, winnerPlaces);

        if (endTimeChanged) {
            lifecycleScheduler.rescheduleGiveaway(updated);
        }
        refreshPost(updated);
        return updated;
    }

    public void cancelGiveaway(Long giveawayId) {
        giveawayService.getGiveaway(giveawayId);
        lifecycleScheduler.cancelGiveawaySchedule(giveawayId);
        giveawayService.cancelGiveaway(giveawayId);
    }

    public void deleteGiveaway(Long giveawayId) {
        giveawayService.getGiveaway(giveawayId);
        lifecycleScheduler.cancelGiveawaySchedule(giveawayId);
        giveawayService.deleteGiveaway(giveawayId);
    }

    /**
     * Remove a channel and its subscriber registry. Refused while the channel has active giveaways.
     */
    public void removeChannel(Long channelId) {
        channelService.getChannel(channelId);
        int active = giveawayService.getActiveGiveaways(channelId).size();
        if (active > 0) {
            throw new BusinessException("Channel " + channelId + " has " + active + " active giveaways");
        }
        channelService.removeChannel(channelId);
    }

    /**
     * Finish an active giveaway ahead of its end time
     * @throws ConflictException when a concurrent run closed it first
     * @throws ServiceUnavailableException when the draw could not be stored; the giveaway stays active
     */
    public FinishResult finishNow(Long giveawayId) {
        Giveaway giveaway = giveawayService.getGiveaway(giveawayId);
        if (!giveaway.isActive()) {
            throw new BusinessException("Giveaway is already " + giveaway.getStatus().getValue());
        }

        FinishResult result = lifecycleScheduler.finishGiveaway(giveawayId);
        if (result.outcome() == FinishOutcome.SKIPPED) {
            throw new ConflictException("Giveaway " + giveawayId + " was closed by another run");
        }
        if (result.outcome() == FinishOutcome.FAILED) {
            throw new ServiceUnavailableException(
                    "Could not store the results of giveaway " + giveawayId + ", it stays active",
                    FINISH_RETRY_AFTER_SECONDS);
        }
        return result;
    }

    /**
     * Handle a participate button press. Subscription is checked on join as well as at the draw.
     */
    public ParticipationResult participate(Long giveawayId, Long userId, String username,
                                           String firstName, String fullName) {
        Giveaway giveaway = giveawayService.findGiveaway(giveawayId).orElse(null);
        if (giveaway == null || !giveaway.isActive()
                || !giveaway.getEndInstant().isAfter(clock.instant())) {
            return ParticipationResult.GIVEAWAY_ENDED;
        }

        if (!eligibilityChecker.isEligible(userId, giveaway.getChannelId())) {
            return ParticipationResult.NOT_SUBSCRIBED;
        }

        if (!giveawayService.addParticipant(giveawayId, userId, username, firstName, fullName)) {
            return ParticipationResult.ALREADY_PARTICIPATING;
        }

        log.info("User {} joined giveaway {}", userId, giveawayId);
        refreshParticipateButton(giveaway);
        return ParticipationResult.JOINED;
    }

    private void refreshPost(Giveaway giveaway) {
        if (giveaway.getMessageId() == null) {
            return;
        }
        try {
            long count = giveawayService.getParticipantsCount(giveaway.getId());
            botMessenger.editMessageText(giveaway.getChannelId(), giveaway.getMessageId(),
                    renderer.renderGiveawayPost(giveaway),
                    keyboardFactory.participateKeyboard(giveaway.getId(), count));
        } catch (Exception e) {
            log.warn("Could not update post of giveaway {}: {}", giveaway.getId(), e.getMessage());
        }
    }

    private void refreshParticipateButton(Giveaway giveaway) {
        if (giveaway.getMessageId() == null) {
            return;
        }
        try {
            long count = giveawayService.getParticipantsCount(giveaway.getId());
            botMessenger.editMessageReplyMarkup(giveaway.getChannelId(), giveaway.getMessageId(),
                    keyboardFactory.participateKeyboard(giveaway.getId(), count));
        } catch (Exception e) {
            log.warn("Could not refresh participate button of giveaway {}: {}", giveaway.getId(), e.getMessage());
        }
    }
}
