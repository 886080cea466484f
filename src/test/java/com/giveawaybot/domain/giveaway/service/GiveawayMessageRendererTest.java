package com.giveawaybot.domain.giveaway.service;

import com.giveawaybot.config.I18nConfig;
import com.giveawaybot.domain.common.enums.DeliveryOutcome;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.domain.giveaway.entity.Participant;
import com.giveawaybot.job.ReminderTier;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GiveawayMessageRendererTest {

    private final GiveawayMessageRenderer renderer =
            new GiveawayMessageRenderer(new I18nConfig().messageSource(), "Europe/Moscow");

    @Test
    void renderWinnersAnnouncement_SingleWinner_UsesWinnerLine() {
        String text = renderer.renderWinnersAnnouncement(List.of(draw(1L, "alice", "Alice", 1)));

        assertTrue(text.contains("РОЗЫГРЫШ ЗАВЕРШЕН"));
        assertTrue(text.contains("🏆 <b>Победитель:</b> @alice"));
        assertFalse(text.contains("место"));
    }

    @Test
    void renderWinnersAnnouncement_SeveralWinners_ListsPlacesWithMedals() {
        String text = renderer.renderWinnersAnnouncement(List.of(
                draw(1L, "alice", "Alice", 1),
                draw(2L, null, "Bob", 2),
                draw(3L, null, null, 3),
                draw(4L, "dave", null, 4)));

        assertTrue(text.contains("🥇 <b>1 место:</b> @alice"));
        assertTrue(text.contains("🥈 <b>2 место:</b> Bob"));
        assertTrue(text.contains("🥉 <b>3 место:</b> Пользователь"));
        assertTrue(text.contains("4. <b>4 место:</b> @dave"));
    }

    @Test
    void renderWinnersAnnouncement_EscapesHtmlInNames() {
        String text = renderer.renderWinnersAnnouncement(List.of(draw(1L, null, "<b>Eve</b>", 1)));

        assertTrue(text.contains("&lt;b&gt;Eve&lt;/b&gt;"));
    }

    @Test
    void renderWinnerMessage_FillsPlaceholders() {
        Giveaway giveaway = giveaway("Iphone", "Вы заняли {place} место в розыгрыше {title}!");

        assertEquals("Вы заняли 2 место в розыгрыше Iphone!", renderer.renderWinnerMessage(giveaway, 2));
    }

    @Test
    void renderWinnerMessage_NoTemplate_UsesDefault() {
        Giveaway giveaway = giveaway("Iphone", " ");

        String text = renderer.renderWinnerMessage(giveaway, 1);

        assertTrue(text.contains("Поздравляем"));
        assertTrue(text.contains("1 место"));
        assertTrue(text.contains("Iphone"));
    }

    @Test
    void renderAdminSummary_MarksDeliveryPerWinner() {
        Giveaway giveaway = giveaway("Iphone", null);
        giveaway.setId(10L);

        String text = renderer.renderAdminSummary(giveaway, 5, 3,
                List.of(draw(1L, "alice", null, 1), draw(2L, "bob", null, 2)),
                Map.of(1L, DeliveryOutcome.SUCCESS, 2L, DeliveryOutcome.BLOCKED));

        assertTrue(text.contains("✅ 1 место: @alice (id 1)"));
        assertTrue(text.contains("❌ 2 место: @bob (id 2)"));
        assertTrue(text.contains("Уведомления доставлены: 1 из 2"));
    }

    @Test
    void renderReminder_IncludesTimeLeftAndParticipants() {
        Giveaway giveaway = giveaway("Iphone", null);

        String text = renderer.renderReminder(giveaway, ReminderTier.ONE_DAY, 1234);

        assertTrue(text.contains("завтра"));
        assertTrue(text.contains("Участников: 1234"));
    }

    @Test
    void formatDateTime_ConvertsUtcToDisplayZone() {
        assertEquals("01.03.2026 15:00", renderer.formatDateTime(LocalDateTime.of(2026, 3, 1, 12, 0)));
    }

    private WinnerDraw draw(Long userId, String username, String firstName, int place) {
        return new WinnerDraw(Participant.builder()
                .giveawayId(10L)
                .userId(userId)
                .username(username)
                .firstName(firstName)
                .build(), place);
    }

    private Giveaway giveaway(String title, String messageWinner) {
        return Giveaway.builder()
                .title(title)
                .description("Описание")
                .messageWinner(messageWinner)
                .channelId(-100L)
                .endTime(LocalDateTime.of(2026, 3, 1, 12, 0))
                .winnerPlaces(2)
                .build();
    }
}
