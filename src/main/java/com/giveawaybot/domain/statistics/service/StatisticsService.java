package com.giveawaybot.domain.statistics.service;

import com.giveawaybot.domain.channel.entity.Channel;
import com.giveawaybot.domain.channel.service.ChannelService;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.domain.giveaway.entity.Winner;
import com.giveawaybot.domain.giveaway.service.GiveawayService;
import com.giveawaybot.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics Service
 * Reports per giveaway, per channel and across all channels.
 *
 * Participation rate is participants / subscribers * 100. Subscriber counts at a past moment
 * come from the registry's join and leave timestamps. Percentages are rounded to two decimals.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class StatisticsService {

    private final GiveawayService giveawayService;
    private final ChannelService channelService;
    private final Clock clock;

    public Map<String, Object> giveawayReport(Long giveawayId) {
        Giveaway giveaway = giveawayService.getGiveaway(giveawayId);
        long participants = giveawayService.getParticipantsCount(giveawayId);
        long subscribers = giveaway.getFinishedAt() != null
                ? channelService.countSubscribersAsOf(giveaway.getChannelId(), giveaway.getFinishedAt())
                : channelService.countSubscribers(giveaway.getChannelId());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("id", giveaway.getId());
        report.put("title", giveaway.getTitle());
        report.put("status", giveaway.getStatus().getValue());
        report.put("start_time", giveaway.getStartTime());
        report.put("end_time", giveaway.getEndTime());
        report.put("duration_hours", durationHours(giveaway));
        report.put("channel", channelSummary(giveaway.getChannelId()));
        report.put("created_by", giveaway.getCreatedBy());
        report.put("winner_places", giveaway.getWinnerPlaces());

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("participants", participants);
        statistics.put("subscribers", subscribers);
        statistics.put("participation_rate", rate(participants, subscribers));
        report.put("statistics", statistics);

        List<Map<String, Object>> winners = new ArrayList<>();
        for (Winner winner : giveawayService.getWinners(giveawayId)) {
            Map<String, Object> map = new HashMap<>();
            map.put("place", winner.getPlace());
            map.put("user_id", winner.getUserId());
            map.put("username", winner.getUsername());
            map.put("first_name", winner.getFirstName());
            winners.add(map);
        }
        report.put("winners", winners);
        return report;
    }

    /**
     * Subscriber growth and giveaway engagement of one channel over the last {@code days} days
     */
    public Map<String, Object> channelReport(Long channelId, int days) {
        requirePositive(days);
        Channel channel = channelService.getChannel(channelId);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime start = now.minusDays(days);

        long subscribersStart = channelService.countSubscribersAsOf(channelId, start);
        long subscribersEnd = channelService.countSubscribers(channelId);
        long growth = Math.max(0, subscribersEnd - subscribersStart);

        List<Giveaway> finished = giveawayService.getFinishedGiveawaysSince(start).stream()
                .filter(g -> channelId.equals(g.getChannelId()))
                .toList();

        long totalParticipants = 0;
        long totalWinners = 0;
        List<Double> rates = new ArrayList<>();
        for (Giveaway giveaway : finished) {
            long participants = giveawayService.getParticipantsCount(giveaway.getId());
            long subscribersAtEnd = channelService.countSubscribersAsOf(channelId, giveaway.getEndTime());
            totalParticipants += participants;
            totalWinners += giveawayService.getWinners(giveaway.getId()).size();
            rates.add(rawRate(participants, subscribersAtEnd));
        }
        double avgRate = average(rates);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("channel", channelSummary(channel));
        report.put("period", period(days, start, now));

        Map<String, Object> subscribers = new LinkedHashMap<>();
        subscribers.put("start", subscribersStart);
        subscribers.put("end", subscribersEnd);
        subscribers.put("growth", growth);
        subscribers.put("growth_rate", rate(growth, subscribersStart));
        report.put("subscribers", subscribers);

        Map<String, Object> giveaways = new LinkedHashMap<>();
        giveaways.put("active", giveawayService.getActiveGiveaways(channelId).size());
        giveaways.put("finished_in_period", finished.size());
        giveaways.put("total_participants", totalParticipants);
        giveaways.put("avg_participation_rate", round(avgRate));
        giveaways.put("total_winners", totalWinners);
        report.put("giveaways", giveaways);

        double growthShare = subscribersEnd > 0 ? (double) growth / subscribersEnd : 0;
        report.put("engagement_score", rates.isEmpty() ? 0.0 : round(avgRate * (1 + growthShare) / 2));
        return report;
    }

    /**
     * Totals across every registered channel over the last {@code days} days
     */
    public Map<String, Object> overallReport(int days) {
        requirePositive(days);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime start = now.minusDays(days);

        List<Channel> channels = channelService.findAll();
        List<Giveaway> finished = giveawayService.getFinishedGiveawaysSince(start);

        long totalSubscribers = 0;
        long newSubscribers = 0;
        long totalParticipants = 0;
        List<Double> rates = new ArrayList<>();
        for (Channel channel : channels) {
            long current = channelService.countSubscribers(channel.getChannelId());
            long atStart = channelService.countSubscribersAsOf(channel.getChannelId(), start);
            totalSubscribers += current;
            newSubscribers += Math.max(0, current - atStart);

            for (Giveaway giveaway : finished) {
                if (!channel.getChannelId().equals(giveaway.getChannelId())) {
                    continue;
                }
                long participants = giveawayService.getParticipantsCount(giveaway.getId());
                totalParticipants += participants;
                rates.add(rawRate(participants, current));
            }
        }
        double avgRate = average(rates);

        Map<String, Object> overall = new LinkedHashMap<>();
        overall.put("total_channels", channels.size());
        overall.put("total_subscribers", totalSubscribers);
        overall.put("new_subscribers", newSubscribers);
        overall.put("growth_rate", rate(newSubscribers, totalSubscribers - newSubscribers));
        overall.put("active_giveaways", giveawayService.getActiveGiveaways().size());
        overall.put("finished_giveaways", finished.size());
        overall.put("total_participants", totalParticipants);
        overall.put("avg_participation_rate", round(avgRate));
        overall.put("engagement_index", totalSubscribers > 0
                ? round(avgRate * (1 + (double) newSubscribers / totalSubscribers))
                : 0.0);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("period", period(days, start, now));
        report.put("overall", overall);
        return report;
    }

    private Map<String, Object> channelSummary(Long channelId) {
        return channelService.findChannel(channelId)
                .map(this::channelSummary)
                .orElseGet(() -> {
                    Map<String, Object> map = new HashMap<>();
                    map.put("channel_id", channelId);
                    return map;
                });
    }

    private Map<String, Object> channelSummary(Channel channel) {
        Map<String, Object> map = new HashMap<>();
        map.put("channel_id", channel.getChannelId());
        map.put("name", channel.getChannelName());
        map.put("username", channel.getChannelUsername());
        map.put("added_by", channel.getAddedBy());
        return map;
    }

    private static Map<String, Object> period(int days, LocalDateTime start, LocalDateTime end) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("days", days);
        map.put("start_date", start);
        map.put("end_date", end);
        return map;
    }

    private static double durationHours(Giveaway giveaway) {
        if (giveaway.getStartTime() == null || giveaway.getEndTime() == null) {
            return 0.0;
        }
        long minutes = Duration.between(giveaway.getStartTime(), giveaway.getEndTime()).toMinutes();
        return Math.round(minutes / 6.0) / 10.0;
    }

    private static void requirePositive(int days) {
        if (days <= 0) {
            throw new BusinessException("days must be positive");
        }
    }

    private static double rawRate(long part, long whole) {
        return whole > 0 ? part * 100.0 / whole : 0.0;
    }

    private static double rate(long part, long whole) {
        return round(rawRate(part, whole));
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
