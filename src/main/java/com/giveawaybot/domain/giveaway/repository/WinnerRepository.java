package com.giveawaybot.domain.giveaway.repository;

import com.giveawaybot.domain.giveaway.entity.Winner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WinnerRepository extends JpaRepository<Winner, Long> {

    List<Winner> findByGiveawayIdOrderByPlaceAsc(Long giveawayId);

    @Modifying
    @Query("DELETE FROM Winner w WHERE w.giveawayId IN :giveawayIds")
    int deleteByGiveawayIdIn(@Param("giveawayIds") List<Long> giveawayIds);
}
