package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.config.I18nConfig;
import com.giveawaybot.domain.common.enums.DeliveryOutcome;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.domain.mailing.entity.Mailing;
import com.giveawaybot.domain.mailing.service.DeliveryStats;
import com.giveawaybot.job.ReminderTier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the HTML texts the bot posts: giveaway posts, reminders, results and admin reports.
 * Dynamic values are passed to the message bundle as strings so no locale number formatting applies.
 */
@Component
public class GiveawayMessageRenderer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

    private final MessageSource messageSource;
    private final ZoneId displayZone;

    public GiveawayMessageRenderer(MessageSource messageSource,
                                   @Value("${telegram.display-timezone:Europe/Moscow}") String displayTimezone) {
        this.messageSource = messageSource;
        this.displayZone = ZoneId.of(displayTimezone);
    }

    public String renderGiveawayPost(Giveaway giveaway) {
        return msg("giveaway.post",
                escape(giveaway.getTitle()),
                escape(giveaway.getDescription()),
                String.valueOf(giveaway.getWinnerPlaces()),
                formatDateTime(giveaway.getEndTime()));
    }

    public String renderReminder(Giveaway giveaway, ReminderTier tier, long participantsCount) {
        return msg("reminder.post",
                escape(giveaway.getTitle()),
                msg(tier.getMessageKey()),
                escape(giveaway.getDescription()),
                String.valueOf(giveaway.getWinnerPlaces()),
                formatDateTime(giveaway.getEndTime()),
                String.valueOf(participantsCount));
    }

    public String renderNoParticipants() {
        return msg("finish.no-participants");
    }

    /**
     * Channel announcement. A single prize place gets the plain winner line,
     * otherwise each place is listed with a medal.
     */
    public String renderWinnersAnnouncement(List<WinnerDraw> draws) {
        String lines;
        if (draws.size() == 1) {
            lines = msg("finish.single-winner", displayName(draws.get(0)));
        } else {
            lines = draws.stream()
                    .map(draw -> msg("finish.place", placeMark(draw.place()),
                            String.valueOf(draw.place()), displayName(draw)))
                    .collect(Collectors.joining("\n"));
        }
        return msg("finish.announcement", lines);
    }

    /**
     * Direct message to a winner: the giveaway's own template with {place} and {title} filled in,
     * or the default congratulation when the giveaway has none.
     */
    public String renderWinnerMessage(Giveaway giveaway, int place) {
        String template = giveaway.getMessageWinner();
        if (template == null || template.isBlank()) {
            return msg("winner.default-message", String.valueOf(place), escape(giveaway.getTitle()));
        }
        return template
                .replace("{place}", String.valueOf(place))
                .replace("{title}", escape(giveaway.getTitle()));
    }

    public String renderAdminSummary(Giveaway giveaway, int participantsCount, int eligibleCount,
                                     List<WinnerDraw> draws, Map<Long, DeliveryOutcome> outcomes) {
        String winnerLines;
        long delivered = 0;
        if (draws.isEmpty()) {
            winnerLines = msg("admin.summary.no-winners");
        } else {
            winnerLines = draws.stream()
                    .map(draw -> msg("admin.summary.winner-line",
                            deliveryMark(outcomes.get(draw.userId())),
                            String.valueOf(draw.place()),
                            displayName(draw),
                            String.valueOf(draw.userId())))
                    .collect(Collectors.joining("\n"));
            delivered = draws.stream()
                    .map(draw -> outcomes.get(draw.userId()))
                    .filter(outcome -> outcome != null && outcome.isSuccess())
                    .count();
        }

        return msg("admin.summary",
                String.valueOf(giveaway.getId()),
                escape(giveaway.getTitle()),
                String.valueOf(participantsCount),
                String.valueOf(eligibleCount),
                winnerLines,
                String.valueOf(delivered),
                String.valueOf(draws.size()));
    }

    public String renderMailingReport(Mailing mailing, DeliveryStats stats) {
        String statusKey = stats.isStopped() ? "mailing.status.cancelled" : "mailing.status.done";
        return msg("mailing.report",
                String.valueOf(mailing.getId()),
                msg(statusKey),
                String.valueOf(stats.getTotalSent()),
                String.valueOf(stats.getSuccessful()),
                String.valueOf(stats.getBlocked()),
                String.valueOf(stats.getThrottled()),
                String.valueOf(stats.getOtherErrors()),
                String.valueOf(stats.getDuration().getSeconds()),
                String.format("%.1f", stats.successRate()));
    }

    public String formatDateTime(LocalDateTime utcDateTime) {
        return utcDateTime.atOffset(ZoneOffset.UTC)
                .atZoneSameInstant(displayZone)
                .format(DATE_FORMAT);
    }

    public String msg(String key, Object... args) {
        return messageSource.getMessage(key, args, I18nConfig.BOT_LOCALE);
    }

    private String displayName(WinnerDraw draw) {
        return displayName(draw.participant().getUsername(), draw.participant().getFirstName());
    }

    String displayName(String username, String firstName) {
        if (username != null && !username.isBlank()) {
            return "@" + escape(username);
        }
        if (firstName != null && !firstName.isBlank()) {
            return escape(firstName);
        }
        return msg("user.default-name");
    }

    private String placeMark(int place) {
        return switch (place) {
            case 1 -> "🥇";
            case 2 -> "🥈";
            case 3 -> "🥉";
            default -> place + ".";
        };
    }

    private String deliveryMark(DeliveryOutcome outcome) {
        return outcome != null && outcome.isSuccess() ? "✅" : "❌";
    }

    private String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
