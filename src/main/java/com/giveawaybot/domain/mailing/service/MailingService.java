package com.giveawaybot.domain.mailing.service;

import com.giveawaybot.domain.admin.service.AdminService;
import com.giveawaybot.domain.channel.service.ChannelService;
import com.giveawaybot.domain.common.enums.AudienceType;
import com.giveawaybot.domain.common.enums.MailingStatus;
import com.giveawaybot.domain.giveaway.service.GiveawayMessageRenderer;
import com.giveawaybot.domain.mailing.entity.Mailing;
import com.giveawaybot.domain.mailing.repository.MailingRepository;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.exception.ResourceNotFoundException;
import com.giveawaybot.integration.telegram.BotMessenger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MailingService
 * Admin-launched mailings to a channel audience, sent in the background through {@link BulkDeliveryEngine}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailingService {

    private final MailingRepository mailingRepository;
    private final ChannelService channelService;
    private final AdminService adminService;
    private final BulkDeliveryEngine deliveryEngine;
    private final BotMessenger botMessenger;
    private final GiveawayMessageRenderer renderer;
    private final Clock clock;

    // Stop signals of mailings being sent, by mailing id
    private final Map<Long, StopSignal> stopSignals = new ConcurrentHashMap<>();

    /**
     * Create a PENDING mailing; the audience size is fixed at creation for progress reporting
     */
    @Transactional
    public Mailing createMailing(Long channelId, Long adminId, AudienceType audienceType, String messageText) {
        if (messageText == null || messageText.isBlank()) {
            throw new BusinessException("Mailing text is required");
        }
        if (adminId == null) {
            throw new BusinessException("admin_id is required");
        }
        adminService.requireAdmin(adminId);
        channelService.getChannel(channelId);

        List<Long> audience = channelService.getAudience(channelId, audienceType);
        if (audience.isEmpty()) {
            throw new BusinessException("Audience " + audienceType + " of channel " + channelId + " is empty");
        }

        Mailing mailing = mailingRepository.save(Mailing.builder()
                .channelId(channelId)
                .adminId(adminId)
                .audienceType(audienceType)
                .messageText(messageText)
                .totalUsers(audience.size())
                .status(MailingStatus.PENDING)
                .build());

        log.info("Created mailing {} for channel {} ({} recipients, {})",
                mailing.getId(), channelId, audience.size(), audienceType);
        return mailing;
    }

    /**
     * Send a PENDING mailing on the task executor.
     * The stop signal is registered before the mailing is claimed, so a cancel can never miss a started run.
     */
    @Async("taskExecutor")
    public void runMailing(Long mailingId) {
        StopSignal stopSignal = new StopSignal();
        if (stopSignals.putIfAbsent(mailingId, stopSignal) != null) {
            log.warn("Mailing {} is already running", mailingId);
            return;
        }

        Mailing mailing = null;
        try {
            if (mailingRepository.claimPending(mailingId) == 0) {
                log.warn("Mailing {} is missing or no longer pending, not starting", mailingId);
                return;
            }
            mailing = getMailing(mailingId);

            List<Long> audience = channelService.getAudience(mailing.getChannelId(), mailing.getAudienceType());
            mailing.setTotalUsers(audience.size());
            mailing = mailingRepository.save(mailing);

            DeliveryOptions options = deliveryEngine.defaultOptions().toBuilder()
                    .progressListener((processed, total, stats) -> saveProgress(mailingId, stats))
                    .build();

            DeliveryStats stats = deliveryEngine.sendBulk(audience, mailing.getMessageText(), options, stopSignal);

            applyCounts(mailing, stats);
            mailing.setStatus(stats.isStopped() ? MailingStatus.CANCELLED : MailingStatus.DONE);
            mailing.setFinishedAt(LocalDateTime.now(clock));
            mailing = mailingRepository.save(mailing);

            log.info("Mailing {} {}: {} sent, {} blocked, {} failed",
                    mailingId, mailing.getStatus(), mailing.getSentCount(),
                    mailing.getBlockedCount(), mailing.getFailedCount());

            reportToAdmin(mailing, stats);
        } catch (Exception e) {
            log.error("Mailing {} failed: {}", mailingId, e.getMessage(), e);
            if (mailing != null) {
                mailing.setStatus(MailingStatus.FAILED);
                mailing.setFinishedAt(LocalDateTime.now(clock));
                mailingRepository.save(mailing);
            }
        } finally {
            stopSignals.remove(mailingId);
        }
    }

    /**
     * Stop a mailing. A pending one is cancelled right away; a running one stops before its next send.
     */
    public void cancelMailing(Long mailingId) {
        Mailing mailing = getMailing(mailingId);
        if (mailing.getStatus().isTerminal()) {
            throw new BusinessException("Mailing is already " + mailing.getStatus().name().toLowerCase());
        }

        if (mailingRepository.cancelIfPending(mailingId, LocalDateTime.now(clock)) > 0) {
            log.info("Mailing {} cancelled before start", mailingId);
            return;
        }

        // Claimed by a run: its stop signal stays registered until the run ends
        StopSignal stopSignal = stopSignals.get(mailingId);
        if (stopSignal != null) {
            stopSignal.stop();
            log.info("Stop requested for mailing {}", mailingId);
        }
    }

    public MailingEstimate estimate(Long channelId, AudienceType audienceType) {
        channelService.getChannel(channelId);
        int recipients = channelService.getAudience(channelId, audienceType).size();
        return new MailingEstimate(channelId, audienceType, recipients,
                deliveryEngine.estimateDeliveryTime(recipients));
    }

    public Mailing getMailing(Long mailingId) {
        return mailingRepository.findById(mailingId)
                .orElseThrow(() -> new ResourceNotFoundException("Mailing", mailingId));
    }

    public List<Mailing> getMailings(Long channelId) {
        return mailingRepository.findByChannelIdOrderByCreatedAtDesc(channelId);
    }

    public boolean isRunning(Long mailingId) {
        return stopSignals.containsKey(mailingId);
    }

    /**
     * Mailings left SENDING by a previous process cannot resume: their stop signal is gone
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedMailings() {
        List<Mailing> interrupted = mailingRepository.findByStatus(MailingStatus.SENDING);
        for (Mailing mailing : interrupted) {
            mailing.setStatus(MailingStatus.FAILED);
            mailing.setFinishedAt(LocalDateTime.now(clock));
            mailingRepository.save(mailing);
        }
        if (!interrupted.isEmpty()) {
            log.warn("Marked {} interrupted mailings as failed", interrupted.size());
        }
    }

    private void saveProgress(Long mailingId, DeliveryStats stats) {
        mailingRepository.findById(mailingId).ifPresent(mailing -> {
            applyCounts(mailing, stats);
            mailingRepository.save(mailing);
            log.debug("Mailing {} progress: {}%", mailingId, mailing.getProgressPercent());
        });
    }

    private void applyCounts(Mailing mailing, DeliveryStats stats) {
        mailing.setSentCount(stats.getSuccessful());
        mailing.setBlockedCount(stats.getBlocked());
        mailing.setFailedCount(stats.getFailed() - stats.getBlocked());
    }

    private void reportToAdmin(Mailing mailing, DeliveryStats stats) {
        try {
            botMessenger.sendMessage(mailing.getAdminId(), renderer.renderMailingReport(mailing, stats));
        } catch (Exception e) {
            log.warn("Could not report mailing {} to admin {}: {}",
                    mailing.getId(), mailing.getAdminId(), e.getMessage());
        }
    }
}
