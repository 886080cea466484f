package com.giveawaybot.domain.giveaway.repository;

import com.giveawaybot.domain.giveaway.entity.Participant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    List<Participant> findByGiveawayIdOrderByJoinedAtAsc(Long giveawayId);

    long countByGiveawayId(Long giveawayId);

    boolean existsByGiveawayIdAndUserId(Long giveawayId, Long userId);

    @Modifying
    @Query("DELETE FROM Participant p WHERE p.giveawayId IN :giveawayIds")
    int deleteByGiveawayIdIn(@Param("giveawayIds") List<Long> giveawayIds);
}
