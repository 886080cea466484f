package com.giveawaybot.domain.mailing.repository;

import com.giveawaybot.domain.common.enums.MailingStatus;
import com.giveawaybot.domain.mailing.entity.Mailing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MailingRepository extends JpaRepository<Mailing, Long> {

    List<Mailing> findByStatus(MailingStatus status);

    List<Mailing> findByChannelIdOrderByCreatedAtDesc(Long channelId);

    /**
     * Moves a pending mailing to SENDING.
     * Returns 0 when the mailing is gone or no longer pending.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Mailing m SET m.status = com.giveawaybot.domain.common.enums.MailingStatus.SENDING " +
           "WHERE m.id = :id AND m.status = com.giveawaybot.domain.common.enums.MailingStatus.PENDING")
    int claimPending(@Param("id") Long id);

    /**
     * Cancels a mailing that has not started yet.
     * Returns 0 when the mailing is gone or no longer pending.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Mailing m SET m.status = com.giveawaybot.domain.common.enums.MailingStatus.CANCELLED, " +
           "m.finishedAt = :at " +
           "WHERE m.id = :id AND m.status = com.giveawaybot.domain.common.enums.MailingStatus.PENDING")
    int cancelIfPending(@Param("id") Long id, @Param("at") LocalDateTime at);
}
