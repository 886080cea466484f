package com.giveawaybot.domain.channel.repository;

import com.giveawaybot.domain.channel.entity.ChannelSubscriber;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ChannelSubscriberRepository extends JpaRepository<ChannelSubscriber, Long> {

    Optional<ChannelSubscriber> findByChannelIdAndUserId(Long channelId, Long userId);

    List<ChannelSubscriber> findByChannelIdAndLeftAtIsNull(Long channelId);

    @Query("SELECT s FROM ChannelSubscriber s WHERE s.channelId = :channelId AND s.leftAt IS NULL " +
           "AND s.lastActivityAt >= :since")
    List<ChannelSubscriber> findActiveSince(@Param("channelId") Long channelId,
                                            @Param("since") LocalDateTime since);

    long countByChannelIdAndLeftAtIsNull(Long channelId);

    @Query("SELECT COUNT(s) FROM ChannelSubscriber s WHERE s.channelId = :channelId AND s.addedAt <= :asOf " +
           "AND (s.leftAt IS NULL OR s.leftAt > :asOf)")
    long countSubscribedAsOf(@Param("channelId") Long channelId, @Param("asOf") LocalDateTime asOf);

    @Modifying
    @Query("DELETE FROM ChannelSubscriber s WHERE s.channelId = :channelId")
    int deleteByChannelId(@Param("channelId") Long channelId);
}
