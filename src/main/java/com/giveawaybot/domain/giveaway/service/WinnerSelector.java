package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.domain.giveaway.entity.Participant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Uniform draw without replacement.
 * Places follow the order in which the sample is produced and carry no ranking.
 */
@Component
@RequiredArgsConstructor
public class WinnerSelector {

    private final Random random;

    /**
     * Draws min(requestedPlaces, pool size) distinct winners, places 1..n.
     * Returns an empty list when nobody can be drawn.
     */
    public List<WinnerDraw> selectWinners(List<Participant> eligiblePool, int requestedPlaces) {
        int count = Math.min(requestedPlaces, eligiblePool.size());
        if (count <= 0) {
            return List.of();
        }

        // Partial Fisher-Yates: the first `count` slots end up a uniform sample
        List<Participant> pool = new ArrayList<>(eligiblePool);
        List<WinnerDraw> draws = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int pick = i + random.nextInt(pool.size() - i);
            Collections.swap(pool, i, pick);
            draws.add(new WinnerDraw(pool.get(i), i + 1));
        }
        return draws;
    }
}
