package com.giveawaybot.job;

import com.giveawaybot.config.GiveawayProperties;
import com.giveawaybot.config.I18nConfig;
import com.giveawaybot.domain.channel.entity.Channel;
import com.giveawaybot.domain.channel.service.ChannelService;
import com.giveawaybot.domain.common.enums.DeliveryOutcome;
import com.giveawaybot.domain.common.enums.GiveawayStatus;
import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.domain.giveaway.entity.Participant;
import com.giveawaybot.domain.giveaway.service.EligibilityChecker;
import com.giveawaybot.domain.giveaway.service.GiveawayMessageRenderer;
import com.giveawaybot.domain.giveaway.service.GiveawayService;
import com.giveawaybot.domain.giveaway.service.WinnerDraw;
import com.giveawaybot.domain.giveaway.service.WinnerSelector;
import com.giveawaybot.domain.mailing.service.BulkDeliveryEngine;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.integration.telegram.BotMessenger;
import com.giveawaybot.integration.telegram.DirectMessenger;
import com.giveawaybot.integration.telegram.InlineKeyboardFactory;
import com.giveawaybot.integration.telegram.SendResult;
import com.giveawaybot.integration.telegram.TelegramApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.MessageSource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GiveawayLifecycleSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Long GIVEAWAY_ID = 10L;
    private static final Long CHANNEL_ID = -100500L;
    private static final Long POST_ID = 77L;
    private static final Long CHANNEL_ADMIN = 42L;

    @Mock
    private TimerService timerService;

    @Mock
    private GiveawayService giveawayService;

    @Mock
    private ChannelService channelService;

    @Mock
    private EligibilityChecker eligibilityChecker;

    @Mock
    private BotMessenger botMessenger;

    @Mock
    private DirectMessenger directMessenger;

    private GiveawayLifecycleScheduler scheduler;
    private GiveawayProperties properties;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        properties = new GiveawayProperties();
        MessageSource messageSource = new I18nConfig().messageSource();

        BulkDeliveryEngine deliveryEngine = new BulkDeliveryEngine(
                directMessenger, new Random(3), clock, duration -> { }, properties);

        scheduler = new GiveawayLifecycleScheduler(
                timerService,
                giveawayService,
                channelService,
                eligibilityChecker,
                new WinnerSelector(new Random(7)),
                deliveryEngine,
                botMessenger,
                new GiveawayMessageRenderer(messageSource, "Europe/Moscow"),
                new InlineKeyboardFactory(messageSource),
                properties,
                clock);
        ReflectionTestUtils.setField(scheduler, "mainAdminId", 1L);
    }

    // --- finish ---

    @Test
    void finishGiveaway_FiveParticipantsThreeEligible_DrawsTwoAndNotifiesBoth() {
        Giveaway giveaway = giveaway(Duration.ofMinutes(-5), 2);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipants(GIVEAWAY_ID)).thenReturn(participants(5));
        Set<Long> eligible = Set.of(1L, 3L, 5L);
        when(eligibilityChecker.isEligible(anyLong(), eq(CHANNEL_ID)))
                .thenAnswer(inv -> eligible.contains(inv.<Long>getArgument(0)));
        when(giveawayService.finishGiveaway(eq(GIVEAWAY_ID), anyList())).thenReturn(true);
        when(channelService.findChannel(CHANNEL_ID)).thenReturn(Optional.of(channel()));

        AtomicBoolean firstSend = new AtomicBoolean(true);
        when(directMessenger.sendDirectMessage(anyLong(), anyString())).thenAnswer(inv ->
                firstSend.getAndSet(false) ? SendResult.blocked("Forbidden: bot was blocked by the user")
                        : SendResult.success());

        FinishResult result = scheduler.finishGiveaway(GIVEAWAY_ID);

        assertEquals(FinishOutcome.FINISHED, result.outcome());
        assertEquals(List.of(1, 2), result.winners().stream().map(WinnerDraw::place).toList());
        assertTrue(eligible.containsAll(result.winners().stream().map(WinnerDraw::userId).toList()));
        assertEquals(2, result.winners().stream().map(WinnerDraw::userId).distinct().count());

        assertEquals(2, result.notifications().size());
        assertEquals(1, result.notifications().values().stream().filter(o -> o == DeliveryOutcome.BLOCKED).count());
        assertEquals(1, result.notifications().values().stream().filter(o -> o == DeliveryOutcome.SUCCESS).count());
        verify(directMessenger, times(2)).sendDirectMessage(anyLong(), contains("место"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<WinnerDraw>> persisted = ArgumentCaptor.forClass(List.class);
        verify(giveawayService).finishGiveaway(eq(GIVEAWAY_ID), persisted.capture());
        assertEquals(result.winners(), persisted.getValue());

        verify(botMessenger).sendMessage(eq(CHANNEL_ID), contains("РОЗЫГРЫШ ЗАВЕРШЕН"), isNull(), eq(POST_ID));
        verify(botMessenger).sendMessage(eq(CHANNEL_ADMIN), contains("Итоги розыгрыша #10"));
        verify(timerService).cancel("finish_giveaway_10");
    }

    @Test
    void finishGiveaway_MorePlacesThanEligible_DrawsWholePool() {
        Giveaway giveaway = giveaway(Duration.ofMinutes(-5), 5);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipants(GIVEAWAY_ID)).thenReturn(participants(2));
        when(eligibilityChecker.isEligible(anyLong(), eq(CHANNEL_ID))).thenReturn(true);
        when(giveawayService.finishGiveaway(eq(GIVEAWAY_ID), anyList())).thenReturn(true);
        when(channelService.findChannel(CHANNEL_ID)).thenReturn(Optional.of(channel()));
        when(directMessenger.sendDirectMessage(anyLong(), anyString())).thenReturn(SendResult.success());

        FinishResult result = scheduler.finishGiveaway(GIVEAWAY_ID);

        assertEquals(FinishOutcome.FINISHED, result.outcome());
        assertEquals(2, result.winners().size());
        assertEquals(List.of(1, 2), result.winners().stream().map(WinnerDraw::place).toList());
    }

    @Test
    void finishGiveaway_NoEligibleParticipants_FinishesWithNoParticipantsMessage() {
        Giveaway giveaway = giveaway(Duration.ofMinutes(-5), 2);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipants(GIVEAWAY_ID)).thenReturn(participants(2));
        when(eligibilityChecker.isEligible(anyLong(), eq(CHANNEL_ID))).thenReturn(false);
        when(giveawayService.finishGiveaway(GIVEAWAY_ID, List.of())).thenReturn(true);
        when(channelService.findChannel(CHANNEL_ID)).thenReturn(Optional.of(channel()));

        FinishResult result = scheduler.finishGiveaway(GIVEAWAY_ID);

        assertEquals(FinishOutcome.NO_PARTICIPANTS, result.outcome());
        assertTrue(result.winners().isEmpty());
        verify(botMessenger).sendMessage(eq(CHANNEL_ID), contains("не было участников"), isNull(), eq(POST_ID));
        verifyNoInteractions(directMessenger);
    }

    @Test
    void finishGiveaway_CalledTwice_SecondRunIsNoOp() {
        Giveaway active = giveaway(Duration.ofMinutes(-5), 1);
        Giveaway finished = giveaway(Duration.ofMinutes(-5), 1);
        finished.setStatus(GiveawayStatus.FINISHED);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(active), Optional.of(finished));
        when(giveawayService.getParticipants(GIVEAWAY_ID)).thenReturn(participants(1));
        when(eligibilityChecker.isEligible(1L, CHANNEL_ID)).thenReturn(true);
        when(giveawayService.finishGiveaway(eq(GIVEAWAY_ID), anyList())).thenReturn(true);
        when(channelService.findChannel(CHANNEL_ID)).thenReturn(Optional.of(channel()));
        when(directMessenger.sendDirectMessage(eq(1L), anyString())).thenReturn(SendResult.success());

        assertEquals(FinishOutcome.FINISHED, scheduler.finishGiveaway(GIVEAWAY_ID).outcome());
        assertEquals(FinishOutcome.SKIPPED, scheduler.finishGiveaway(GIVEAWAY_ID).outcome());

        verify(giveawayService, times(1)).finishGiveaway(eq(GIVEAWAY_ID), anyList());
        verify(botMessenger, times(1)).sendMessage(eq(CHANNEL_ID), anyString(), isNull(), eq(POST_ID));
        verify(directMessenger, times(1)).sendDirectMessage(eq(1L), anyString());
    }

    @Test
    void finishGiveaway_ConcurrentRunClosedItFirst_SkipsAnnouncements() {
        Giveaway giveaway = giveaway(Duration.ofMinutes(-5), 1);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipants(GIVEAWAY_ID)).thenReturn(participants(1));
        when(eligibilityChecker.isEligible(1L, CHANNEL_ID)).thenReturn(true);
        when(giveawayService.finishGiveaway(eq(GIVEAWAY_ID), anyList())).thenReturn(false);

        assertEquals(FinishOutcome.SKIPPED, scheduler.finishGiveaway(GIVEAWAY_ID).outcome());

        verifyNoInteractions(botMessenger, directMessenger);
    }

    @Test
    void finishGiveaway_PersistenceFails_SendsNothingAndKeepsSchedule() {
        Giveaway giveaway = giveaway(Duration.ofMinutes(-5), 1);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipants(GIVEAWAY_ID)).thenReturn(participants(1));
        when(eligibilityChecker.isEligible(1L, CHANNEL_ID)).thenReturn(true);
        when(giveawayService.finishGiveaway(eq(GIVEAWAY_ID), anyList()))
                .thenThrow(new DataAccessResourceFailureException("connection lost"));

        FinishResult result = scheduler.finishGiveaway(GIVEAWAY_ID);

        assertEquals(FinishOutcome.FAILED, result.outcome());
        verifyNoInteractions(botMessenger, directMessenger);
        verify(timerService, never()).cancel(anyString());
    }

    @Test
    void finishGiveaway_AnnouncementFails_StillNotifiesWinners() {
        Giveaway giveaway = giveaway(Duration.ofMinutes(-5), 1);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipants(GIVEAWAY_ID)).thenReturn(participants(1));
        when(eligibilityChecker.isEligible(1L, CHANNEL_ID)).thenReturn(true);
        when(giveawayService.finishGiveaway(eq(GIVEAWAY_ID), anyList())).thenReturn(true);
        when(botMessenger.sendMessage(eq(CHANNEL_ID), anyString(), isNull(), eq(POST_ID)))
                .thenThrow(new TelegramApiException(400, "Bad Request: not enough rights", null));
        when(channelService.findChannel(CHANNEL_ID)).thenReturn(Optional.empty());
        when(directMessenger.sendDirectMessage(eq(1L), anyString())).thenReturn(SendResult.success());

        FinishResult result = scheduler.finishGiveaway(GIVEAWAY_ID);

        assertEquals(FinishOutcome.FINISHED, result.outcome());
        assertEquals(DeliveryOutcome.SUCCESS, result.notifications().get(1L));
        // no channel admin: summary goes to the giveaway creator
        verify(botMessenger).sendMessage(eq(5L), contains("Итоги розыгрыша"));
    }

    @Test
    void finishGiveaway_Missing_Skipped() {
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.empty());

        assertEquals(FinishOutcome.SKIPPED, scheduler.finishGiveaway(GIVEAWAY_ID).outcome());
        verify(giveawayService, never()).getParticipants(anyLong());
    }

    // --- scheduling ---

    @Test
    void scheduleGiveaway_FarFuture_SchedulesFinishAndAllReminders() {
        Giveaway giveaway = giveaway(Duration.ofDays(5), 1);

        scheduler.scheduleGiveaway(giveaway);

        Instant end = NOW.plus(Duration.ofDays(5));
        verify(timerService).schedule(eq("finish_giveaway_10"), anyString(), eq(end), any(Runnable.class));
        verify(timerService).schedule(eq("reminder_3d_10"), anyString(), eq(end.minus(Duration.ofDays(3))), any(Runnable.class));
        verify(timerService).schedule(eq("reminder_1d_10"), anyString(), eq(end.minus(Duration.ofDays(1))), any(Runnable.class));
        verify(timerService).schedule(eq("reminder_3h_10"), anyString(), eq(end.minus(Duration.ofHours(3))), any(Runnable.class));
    }

    @Test
    void scheduleGiveaway_EndsInTwoHours_SkipsPastReminderTiers() {
        Giveaway giveaway = giveaway(Duration.ofHours(2), 1);

        scheduler.scheduleGiveaway(giveaway);

        verify(timerService).schedule(eq("finish_giveaway_10"), anyString(), any(Instant.class), any(Runnable.class));
        verify(timerService, never()).schedule(startsWith("reminder_"), anyString(), any(Instant.class), any(Runnable.class));
    }

    @Test
    void scheduleGiveaway_Overdue_FinishesImmediately() {
        Giveaway giveaway = giveaway(Duration.ofHours(-1), 1);

        scheduler.scheduleGiveaway(giveaway);

        verify(timerService).schedule(eq("finish_giveaway_10"), anyString(), eq(NOW), any(Runnable.class));
    }

    @Test
    void scheduleFinish_FiredJob_RunsFinish() {
        Giveaway giveaway = giveaway(Duration.ofDays(1), 1);
        ArgumentCaptor<Runnable> job = ArgumentCaptor.forClass(Runnable.class);

        scheduler.scheduleFinish(giveaway);
        verify(timerService).schedule(eq("finish_giveaway_10"), anyString(), any(Instant.class), job.capture());

        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.empty());
        job.getValue().run();
        verify(giveawayService).findGiveaway(GIVEAWAY_ID);
    }

    @Test
    void restoreSchedules_SchedulesEveryActiveGiveaway() {
        Giveaway future = giveaway(Duration.ofDays(2), 1);
        Giveaway overdue = giveaway(Duration.ofDays(-1), 1);
        overdue.setId(11L);
        when(giveawayService.getActiveGiveaways()).thenReturn(List.of(future, overdue));

        scheduler.restoreSchedules();

        verify(timerService).schedule(eq("finish_giveaway_10"), anyString(), eq(NOW.plus(Duration.ofDays(2))), any(Runnable.class));
        verify(timerService).schedule(eq("finish_giveaway_11"), anyString(), eq(NOW), any(Runnable.class));
        assertTrue(scheduler.getReminderState(10L).isPresent());
        assertTrue(scheduler.getReminderState(11L).isPresent());
    }

    // --- reminders ---

    @Test
    void sendReminder_SameTierTwice_PostsOnce() {
        Giveaway giveaway = giveaway(Duration.ofDays(2), 1);
        scheduler.scheduleGiveaway(giveaway);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipantsCount(GIVEAWAY_ID)).thenReturn(4L);

        assertTrue(scheduler.sendReminder(GIVEAWAY_ID, ReminderTier.ONE_DAY));
        assertFalse(scheduler.sendReminder(GIVEAWAY_ID, ReminderTier.ONE_DAY));

        verify(botMessenger, times(1)).sendMessage(eq(CHANNEL_ID), contains("Напоминание"), anyMap(), isNull());
        assertTrue(scheduler.getReminderState(GIVEAWAY_ID).orElseThrow().hasFired(ReminderTier.ONE_DAY));
    }

    @Test
    void sendReminder_PostFails_TierStaysUnfired() {
        Giveaway giveaway = giveaway(Duration.ofDays(2), 1);
        scheduler.scheduleGiveaway(giveaway);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipantsCount(GIVEAWAY_ID)).thenReturn(0L);
        when(botMessenger.sendMessage(eq(CHANNEL_ID), anyString(), anyMap(), isNull()))
                .thenThrow(new TelegramApiException(500, "Internal Server Error", null))
                .thenReturn(100L);

        assertFalse(scheduler.sendReminder(GIVEAWAY_ID, ReminderTier.ONE_DAY));
        assertTrue(scheduler.sendReminder(GIVEAWAY_ID, ReminderTier.ONE_DAY));
    }

    @Test
    void sendReminder_GiveawayNoLongerActive_Skipped() {
        Giveaway giveaway = giveaway(Duration.ofDays(2), 1);
        scheduler.scheduleGiveaway(giveaway);
        giveaway.setStatus(GiveawayStatus.CANCELLED);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));

        assertFalse(scheduler.sendReminder(GIVEAWAY_ID, ReminderTier.THREE_DAYS));
        verifyNoInteractions(botMessenger);
    }

    @Test
    void disableReminders_CancelsJobsAndBlocksSending() {
        Giveaway giveaway = giveaway(Duration.ofDays(5), 1);
        scheduler.scheduleGiveaway(giveaway);
        when(giveawayService.getGiveaway(GIVEAWAY_ID)).thenReturn(giveaway);

        scheduler.disableReminders(GIVEAWAY_ID);

        verify(timerService).cancel("reminder_3d_10");
        verify(timerService).cancel("reminder_1d_10");
        verify(timerService).cancel("reminder_3h_10");
        verify(timerService, never()).cancel("finish_giveaway_10");
        assertFalse(scheduler.sendReminder(GIVEAWAY_ID, ReminderTier.THREE_DAYS));
        assertFalse(scheduler.getReminderState(GIVEAWAY_ID).orElseThrow().isEnabled());
        verifyNoInteractions(botMessenger);
    }

    @Test
    void enableReminders_AfterDisable_ReschedulesTiersStillAhead() {
        Giveaway giveaway = giveaway(Duration.ofHours(30), 1);
        scheduler.scheduleGiveaway(giveaway);
        when(giveawayService.getGiveaway(GIVEAWAY_ID)).thenReturn(giveaway);
        scheduler.disableReminders(GIVEAWAY_ID);
        clearInvocations(timerService);

        int scheduled = scheduler.enableReminders(GIVEAWAY_ID);

        assertEquals(2, scheduled);
        verify(timerService).schedule(eq("reminder_1d_10"), anyString(), any(Instant.class), any(Runnable.class));
        verify(timerService).schedule(eq("reminder_3h_10"), anyString(), any(Instant.class), any(Runnable.class));
        verify(timerService, never()).schedule(eq("reminder_3d_10"), anyString(), any(Instant.class), any(Runnable.class));
        assertTrue(scheduler.getReminderState(GIVEAWAY_ID).orElseThrow().isEnabled());
    }

    @Test
    void reminderToggles_FinishedGiveaway_RejectedWithoutRecreatingState() {
        Giveaway giveaway = giveaway(Duration.ofDays(5), 1);
        scheduler.scheduleGiveaway(giveaway);
        scheduler.cancelGiveawaySchedule(GIVEAWAY_ID);
        giveaway.setStatus(GiveawayStatus.FINISHED);
        when(giveawayService.getGiveaway(GIVEAWAY_ID)).thenReturn(giveaway);
        clearInvocations(timerService);

        assertThrows(BusinessException.class, () -> scheduler.disableReminders(GIVEAWAY_ID));
        assertThrows(BusinessException.class, () -> scheduler.enableReminders(GIVEAWAY_ID));

        assertTrue(scheduler.getReminderState(GIVEAWAY_ID).isEmpty());
        assertTrue(scheduler.getReminderStates().isEmpty());
        verifyNoInteractions(timerService);
    }

    @Test
    void rescheduleGiveaway_NewEndTime_ReplacesJobsAndResetsFiredTiers() {
        Giveaway giveaway = giveaway(Duration.ofDays(2), 1);
        scheduler.scheduleGiveaway(giveaway);
        when(giveawayService.findGiveaway(GIVEAWAY_ID)).thenReturn(Optional.of(giveaway));
        when(giveawayService.getParticipantsCount(GIVEAWAY_ID)).thenReturn(1L);
        assertTrue(scheduler.sendReminder(GIVEAWAY_ID, ReminderTier.ONE_DAY));
        clearInvocations(timerService);

        Instant newEnd = NOW.plus(Duration.ofDays(10));
        giveaway.setEndTime(LocalDateTime.ofInstant(newEnd, ZoneOffset.UTC));
        scheduler.rescheduleGiveaway(giveaway);

        verify(timerService).schedule(eq("finish_giveaway_10"), anyString(), eq(newEnd), any(Runnable.class));
        verify(timerService).schedule(eq("reminder_3d_10"), anyString(), eq(newEnd.minus(Duration.ofDays(3))), any(Runnable.class));
        verify(timerService).schedule(eq("reminder_1d_10"), anyString(), eq(newEnd.minus(Duration.ofDays(1))), any(Runnable.class));
        assertFalse(scheduler.getReminderState(GIVEAWAY_ID).orElseThrow().hasFired(ReminderTier.ONE_DAY));
    }

    @Test
    void rescheduleGiveaway_RemindersDisabled_OnlyMovesFinish() {
        Giveaway giveaway = giveaway(Duration.ofDays(2), 1);
        scheduler.scheduleGiveaway(giveaway);
        when(giveawayService.getGiveaway(GIVEAWAY_ID)).thenReturn(giveaway);
        scheduler.disableReminders(GIVEAWAY_ID);
        clearInvocations(timerService);

        giveaway.setEndTime(LocalDateTime.ofInstant(NOW.plus(Duration.ofDays(6)), ZoneOffset.UTC));
        scheduler.rescheduleGiveaway(giveaway);

        verify(timerService).schedule(eq("finish_giveaway_10"), anyString(), any(Instant.class), any(Runnable.class));
        verify(timerService, never()).schedule(startsWith("reminder_"), anyString(), any(Instant.class), any(Runnable.class));
        assertFalse(scheduler.getReminderState(GIVEAWAY_ID).orElseThrow().isEnabled());
    }

    @Test
    void cancelGiveawaySchedule_CancelsEveryJobAndDropsState() {
        Giveaway giveaway = giveaway(Duration.ofDays(5), 1);
        scheduler.scheduleGiveaway(giveaway);

        scheduler.cancelGiveawaySchedule(GIVEAWAY_ID);

        verify(timerService).cancel("finish_giveaway_10");
        verify(timerService).cancel("reminder_3d_10");
        verify(timerService).cancel("reminder_1d_10");
        verify(timerService).cancel("reminder_3h_10");
        assertTrue(scheduler.getReminderState(GIVEAWAY_ID).isEmpty());
    }

    @Test
    void cleanupFinishedGiveaways_UsesRetentionWindow() {
        properties.getCleanup().setRetentionDays(15);
        when(giveawayService.deleteFinishedOlderThan(15)).thenReturn(3);

        scheduler.cleanupFinishedGiveaways();

        verify(giveawayService).deleteFinishedOlderThan(15);
    }

    private Giveaway giveaway(Duration endOffset, int places) {
        return Giveaway.builder()
                .id(GIVEAWAY_ID)
                .title("Iphone 17")
                .description("Розыгрыш телефона")
                .messageWinner("Вы заняли {place} место в розыгрыше {title}!")
                .channelId(CHANNEL_ID)
                .messageId(POST_ID)
                .endTime(LocalDateTime.ofInstant(NOW.plus(endOffset), ZoneOffset.UTC))
                .status(GiveawayStatus.ACTIVE)
                .winnerPlaces(places)
                .createdBy(5L)
                .build();
    }

    private List<Participant> participants(int count) {
        return LongStream.rangeClosed(1, count)
                .mapToObj(id -> Participant.builder()
                        .giveawayId(GIVEAWAY_ID)
                        .userId(id)
                        .username("user" + id)
                        .build())
                .collect(Collectors.toList());
    }

    private Channel channel() {
        return Channel.builder()
                .channelId(CHANNEL_ID)
                .channelName("Test channel")
                .addedBy(CHANNEL_ADMIN)
                .build();
    }
}
