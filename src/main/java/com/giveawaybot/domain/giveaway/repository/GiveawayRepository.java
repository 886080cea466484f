package com.giveawaybot.domain.giveaway.repository;

import com.giveawaybot.domain.common.enums.GiveawayStatus;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface GiveawayRepository extends JpaRepository<Giveaway, Long> {

    List<Giveaway> findByStatusOrderByEndTimeAsc(GiveawayStatus status);

    List<Giveaway> findByChannelIdAndStatus(Long channelId, GiveawayStatus status);

    List<Giveaway> findByStatusAndEndTimeGreaterThanEqual(GiveawayStatus status, LocalDateTime since);

    /**
     * Moves an active giveaway to a terminal status.
     * Returns 0 when the giveaway is gone or no longer active.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Giveaway g SET g.status = :status, g.finishedAt = :at, g.updatedAt = :at " +
           "WHERE g.id = :id AND g.status = com.giveawaybot.domain.common.enums.GiveawayStatus.ACTIVE")
    int closeIfActive(@Param("id") Long id,
                      @Param("status") GiveawayStatus status,
                      @Param("at") LocalDateTime at);

    @Query("SELECT g.id FROM Giveaway g WHERE g.status = com.giveawaybot.domain.common.enums.GiveawayStatus.FINISHED " +
           "AND g.finishedAt < :threshold")
    List<Long> findFinishedIdsBefore(@Param("threshold") LocalDateTime threshold);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Giveaway g WHERE g.id IN :ids")
    int deleteByIdIn(@Param("ids") List<Long> ids);
}
