package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.domain.common.enums.GiveawayStatus;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.domain.giveaway.entity.Participant;
import com.giveawaybot.domain.giveaway.entity.Winner;
import com.giveawaybot.domain.giveaway.repository.GiveawayRepository;
import com.giveawaybot.domain.giveaway.repository.ParticipantRepository;
import com.giveawaybot.domain.giveaway.repository.WinnerRepository;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Giveaway, participant and winner records
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayService {

    private final GiveawayRepository giveawayRepository;
    private final ParticipantRepository participantRepository;
    private final WinnerRepository winnerRepository;
    private final Clock clock;

    public List<Giveaway> getActiveGiveaways() {
        return giveawayRepository.findByStatusOrderByEndTimeAsc(GiveawayStatus.ACTIVE);
    }

    public Optional<Giveaway> findGiveaway(Long id) {
        return giveawayRepository.findById(id);
    }

    public Giveaway getGiveaway(Long id) {
        return giveawayRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Giveaway", id));
    }

    public List<Giveaway> getActiveGiveaways(Long channelId) {
        return giveawayRepository.findByChannelIdAndStatus(channelId, GiveawayStatus.ACTIVE);
    }

    /**
     * Finished giveaways whose end time is not before the given moment
     */
    public List<Giveaway> getFinishedGiveawaysSince(LocalDateTime since) {
        return giveawayRepository.findByStatusAndEndTimeGreaterThanEqual(GiveawayStatus.FINISHED, since);
    }

    public List<Participant> getParticipants(Long giveawayId) {
        return participantRepository.findByGiveawayIdOrderByJoinedAtAsc(giveawayId);
    }

    public long getParticipantsCount(Long giveawayId) {
        return participantRepository.countByGiveawayId(giveawayId);
    }

    public List<Winner> getWinners(Long giveawayId) {
        return winnerRepository.findByGiveawayIdOrderByPlaceAsc(giveawayId);
    }

    @Transactional
    public Giveaway createGiveaway(String title, String description, String messageWinner,
                                   Long channelId, LocalDateTime endTime, int winnerPlaces, Long createdBy) {
        if (title == null || title.isBlank()) {
            throw new BusinessException("Title is required");
        }
        if (description == null || description.isBlank()) {
            throw new BusinessException("Description is required");
        }
        if (winnerPlaces <= 0) {
            throw new BusinessException("winner_places must be positive");
        }
        if (endTime == null || !endTime.isAfter(LocalDateTime.now(clock))) {
            throw new BusinessException("End time must be in the future");
        }

        Giveaway giveaway = giveawayRepository.save(Giveaway.builder()
                .title(title)
                .description(description)
                .messageWinner(messageWinner)
                .channelId(channelId)
                .startTime(LocalDateTime.now(clock))
                .endTime(endTime)
                .status(GiveawayStatus.ACTIVE)
                .winnerPlaces(winnerPlaces)
                .createdBy(createdBy)
                .build());

        log.info("Giveaway {} created in channel {} ending {}", giveaway.getId(), channelId, endTime);
        return giveaway;
    }

    /**
     * Updates the editable fields of an active giveaway; null leaves a field unchanged
     */
    @Transactional
    public Giveaway updateGiveaway(Long giveawayId, String title, String description, String messageWinner,
                                   LocalDateTime endTime, Integer winnerPlaces) {
        Giveaway giveaway = getGiveaway(giveawayId);
        if (!giveaway.isActive()) {
            throw new BusinessException("Giveaway is already " + giveaway.getStatus().getValue());
        }

        if (title != null) {
            if (title.isBlank()) {
                throw new BusinessException("Title is required");
            }
            giveaway.setTitle(title);
        }
        if (description != null) {
            if (description.isBlank()) {
                throw new BusinessException("Description is required");
            }
            giveaway.setDescription(description);
        }
        if (messageWinner != null) {
            giveaway.setMessageWinner(messageWinner.isBlank() ? null : messageWinner);
        }
        if (endTime != null) {
            if (!endTime.isAfter(LocalDateTime.now(clock))) {
                throw new BusinessException("End time must be in the future");
            }
            giveaway.setEndTime(endTime);
        }
        if (winnerPlaces != null) {
            if (winnerPlaces <= 0) {
                throw new BusinessException("winner_places must be positive");
            }
            giveaway.setWinnerPlaces(winnerPlaces);
        }

        giveaway = giveawayRepository.save(giveaway);
        log.info("Giveaway {} updated", giveawayId);
        return giveaway;
    }

    @Transactional
    public void updateMessageId(Long giveawayId, Long messageId) {
        Giveaway giveaway = getGiveaway(giveawayId);
        giveaway.setMessageId(messageId);
        giveawayRepository.save(giveaway);
    }

    /**
     * Moves the giveaway to FINISHED and stores its winners in one transaction.
     * @return false when the giveaway is no longer active; nothing is written in that case
     */
    @Transactional
    public boolean finishGiveaway(Long giveawayId, List<WinnerDraw> draws) {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = giveawayRepository.closeIfActive(giveawayId, GiveawayStatus.FINISHED, now);
        if (updated == 0) {
            log.info("Giveaway {} is not active, finish skipped", giveawayId);
            return false;
        }

        List<Winner> winners = draws.stream()
                .map(draw -> Winner.builder()
                        .giveawayId(giveawayId)
                        .userId(draw.participant().getUserId())
                        .username(draw.participant().getUsername())
                        .firstName(draw.participant().getFirstName())
                        .fullName(draw.participant().getFullName())
                        .place(draw.place())
                        .wonAt(now)
                        .build())
                .toList();
        winnerRepository.saveAll(winners);

        log.info("Giveaway {} finished with {} winners", giveawayId, winners.size());
        return true;
    }

    @Transactional
    public void cancelGiveaway(Long giveawayId) {
        Giveaway giveaway = getGiveaway(giveawayId);
        int updated = giveawayRepository.closeIfActive(giveawayId, GiveawayStatus.CANCELLED, LocalDateTime.now(clock));
        if (updated == 0) {
            throw new BusinessException("Giveaway is already " + giveaway.getStatus().getValue());
        }
        log.info("Giveaway {} cancelled", giveawayId);
    }

    @Transactional
    public void deleteGiveaway(Long giveawayId) {
        if (!giveawayRepository.existsById(giveawayId)) {
            throw new ResourceNotFoundException("Giveaway", giveawayId);
        }
        List<Long> ids = List.of(giveawayId);
        winnerRepository.deleteByGiveawayIdIn(ids);
        participantRepository.deleteByGiveawayIdIn(ids);
        giveawayRepository.deleteByIdIn(ids);
        log.info("Giveaway {} deleted", giveawayId);
    }

    /**
     * Deletes finished giveaways (with participants and winners) older than the retention window
     * @return number of deleted giveaways
     */
    @Transactional
    public int deleteFinishedOlderThan(int days) {
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(days);
        List<Long> ids = giveawayRepository.findFinishedIdsBefore(threshold);
        if (ids.isEmpty()) {
            return 0;
        }
        winnerRepository.deleteByGiveawayIdIn(ids);
        participantRepository.deleteByGiveawayIdIn(ids);
        return giveawayRepository.deleteByIdIn(ids);
    }

    /**
     * Not transactional: a duplicate insert must not poison an outer transaction.
     * @return false when the user already participates
     */
    public boolean addParticipant(Long giveawayId, Long userId, String username, String firstName, String fullName) {
        if (participantRepository.existsByGiveawayIdAndUserId(giveawayId, userId)) {
            return false;
        }
        try {
            participantRepository.save(Participant.builder()
                    .giveawayId(giveawayId)
                    .userId(userId)
                    .username(username)
                    .firstName(firstName)
                    .fullName(fullName)
                    .joinedAt(LocalDateTime.now(clock))
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("User {} already joined giveaway {}", userId, giveawayId);
            return false;
        }
    }
}
