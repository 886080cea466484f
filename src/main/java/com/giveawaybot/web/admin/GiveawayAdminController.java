package com.giveawaybot.web.admin;

import com.giveawaybot.domain.giveaway.entity.Giveaway;
import com.giveawaybot.domain.giveaway.entity.Participant;
import com.giveawaybot.domain.giveaway.entity.Winner;
import com.giveawaybot.domain.giveaway.service.GiveawayManagementService;
import com.giveawaybot.domain.giveaway.service.GiveawayService;
import com.giveawaybot.job.FinishResult;
import com.giveawaybot.job.GiveawayLifecycleScheduler;
import com.giveawaybot.job.ReminderState;
import com.giveawaybot.job.ReminderTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Giveaway Admin Controller
 * Create, inspect, cancel and finish giveaways
 */
@Slf4j
@RestController
@RequestMapping("/admin/giveaways")
@RequiredArgsConstructor
public class GiveawayAdminController {

    private final GiveawayManagementService managementService;
    private final GiveawayService giveawayService;
    private final GiveawayLifecycleScheduler lifecycleScheduler;

    /**
     * Create and publish a giveaway. end_time is UTC.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreateGiveawayRequest request) {
        Giveaway giveaway = managementService.createGiveaway(
                request.title(),
                request.description(),
                request.messageWinner(),
                request.channelId(),
                request.endTime(),
                request.winnerPlaces(),
                request.createdBy()
        );

        return ResponseEntity.ok(Map.of(
                "result", "success",
                "giveaway", mapGiveawayToResponse(giveaway)
        ));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> index() {
        List<Map<String, Object>> data = giveawayService.getActiveGiveaways().stream()
                .map(this::mapGiveawayToResponse)
                .collect(Collectors.toList());

        return ResponseEntity.ok(Map.of(
                "giveaways", data,
                "total", data.size()
        ));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> show(@PathVariable Long id) {
        Giveaway giveaway = giveawayService.getGiveaway(id);

        Map<String, Object> response = new HashMap<>(mapGiveawayToResponse(giveaway));
        response.put("participants_count", giveawayService.getParticipantsCount(id));
        lifecycleScheduler.getReminderState(id)
                .ifPresent(state -> response.put("reminders", mapReminderState(state)));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}/participants")
    public ResponseEntity<Map<String, Object>> participants(@PathVariable Long id) {
        giveawayService.getGiveaway(id);
        List<Map<String, Object>> data = giveawayService.getParticipants(id).stream()
                .map(this::mapParticipantToResponse)
                .collect(Collectors.toList());

        return ResponseEntity.ok(Map.of(
                "participants", data,
                "total", data.size()
        ));
    }

    @GetMapping("/{id}/winners")
    public ResponseEntity<Map<String, Object>> winners(@PathVariable Long id) {
        giveawayService.getGiveaway(id);
        List<Map<String, Object>> data = giveawayService.getWinners(id).stream()
                .map(this::mapWinnerToResponse)
                .collect(Collectors.toList());

        return ResponseEntity.ok(Map.of("winners", data));
    }

    /**
     * Edit title, description, winner message, end time or places; absent fields stay unchanged
     */
    @PatchMapping("/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable Long id,
                                                      @Valid @RequestBody UpdateGiveawayRequest request) {
        Giveaway giveaway = managementService.updateGiveaway(
                id,
                request.title(),
                request.description(),
                request.messageWinner(),
                request.endTime(),
                request.winnerPlaces()
        );

        return ResponseEntity.ok(Map.of(
                "result", "success",
                "giveaway", mapGiveawayToResponse(giveaway)
        ));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable Long id) {
        managementService.cancelGiveaway(id);
        log.info("Giveaway {} cancelled by admin", id);
        return ResponseEntity.ok(Map.of("result", "success"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long id) {
        managementService.deleteGiveaway(id);
        log.info("Giveaway {} deleted by admin", id);
        return ResponseEntity.ok(Map.of("result", "success"));
    }

    /**
     * Finish now instead of waiting for the end time
     */
    @PostMapping("/{id}/finish")
    public ResponseEntity<Map<String, Object>> finish(@PathVariable Long id) {
        FinishResult result = managementService.finishNow(id);

        List<Map<String, Object>> winners = result.winners().stream()
                .map(draw -> {
                    Map<String, Object> map = new HashMap<>();
                    map.put("place", draw.place());
                    map.put("user_id", draw.userId());
                    map.put("username", draw.participant().getUsername());
                    map.put("notified", result.notifications().get(draw.userId()));
                    return map;
                })
                .collect(Collectors.toList());

        return ResponseEntity.ok(Map.of(
                "result", result.outcome().name(),
                "winners", winners
        ));
    }

    @PostMapping("/{id}/reminders/disable")
    public ResponseEntity<Map<String, Object>> disableReminders(@PathVariable Long id) {
        lifecycleScheduler.disableReminders(id);
        return ResponseEntity.ok(Map.of("result", "success"));
    }

    @PostMapping("/{id}/reminders/enable")
    public ResponseEntity<Map<String, Object>> enableReminders(@PathVariable Long id) {
        int scheduled = lifecycleScheduler.enableReminders(id);
        return ResponseEntity.ok(Map.of(
                "result", "success",
                "scheduled", scheduled
        ));
    }

    private Map<String, Object> mapGiveawayToResponse(Giveaway giveaway) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", giveaway.getId());
        map.put("title", giveaway.getTitle());
        map.put("description", giveaway.getDescription());
        map.put("message_winner", giveaway.getMessageWinner());
        map.put("channel_id", giveaway.getChannelId());
        map.put("message_id", giveaway.getMessageId());
        map.put("start_time", giveaway.getStartTime());
        map.put("end_time", giveaway.getEndTime());
        map.put("status", giveaway.getStatus() != null ? giveaway.getStatus().getValue() : null);
        map.put("winner_places", giveaway.getWinnerPlaces());
        map.put("created_by", giveaway.getCreatedBy());
        map.put("finished_at", giveaway.getFinishedAt());
        return map;
    }

    private Map<String, Object> mapParticipantToResponse(Participant participant) {
        Map<String, Object> map = new HashMap<>();
        map.put("user_id", participant.getUserId());
        map.put("username", participant.getUsername());
        map.put("first_name", participant.getFirstName());
        map.put("full_name", participant.getFullName());
        map.put("joined_at", participant.getJoinedAt());
        return map;
    }

    private Map<String, Object> mapWinnerToResponse(Winner winner) {
        Map<String, Object> map = new HashMap<>();
        map.put("place", winner.getPlace());
        map.put("user_id", winner.getUserId());
        map.put("username", winner.getUsername());
        map.put("first_name", winner.getFirstName());
        map.put("won_at", winner.getWonAt());
        return map;
    }

    static Map<String, Object> mapReminderState(ReminderState state) {
        Map<String, Object> map = new HashMap<>();
        map.put("enabled", state.isEnabled());
        map.put("fired", state.getFiredTiers().stream().map(ReminderTier::getCode).collect(Collectors.toList()));
        return map;
    }

    // --- Request DTOs ---

    public record CreateGiveawayRequest(
            @NotBlank String title,
            @NotBlank String description,
            String messageWinner,
            @NotNull Long channelId,
            @NotNull LocalDateTime endTime,
            @Min(1) int winnerPlaces,
            Long createdBy
    ) {}

    public record UpdateGiveawayRequest(
            String title,
            String description,
            String messageWinner,
            LocalDateTime endTime,
            @Min(1) Integer winnerPlaces
    ) {}
}
