package com.giveawaybot.web.admin;

import com.giveawaybot.domain.common.enums.AudienceType;
import com.giveawaybot.domain.mailing.entity.Mailing;
import com.giveawaybot.domain.mailing.service.MailingEstimate;
import com.giveawaybot.domain.mailing.service.MailingService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Mailing Admin Controller
 * Estimate, launch and stop mailings to channel subscribers
 */
@Slf4j
@RestController
@RequestMapping("/admin/mailings")
@RequiredArgsConstructor
public class MailingAdminController {

    private final MailingService mailingService;

    @GetMapping("/estimate")
    public ResponseEntity<Map<String, Object>> estimate(
            @RequestParam Long channelId,
            @RequestParam(required = false, defaultValue = "ALL") AudienceType audience) {

        MailingEstimate estimate = mailingService.estimate(channelId, audience);
        return ResponseEntity.ok(Map.of(
                "channel_id", estimate.channelId(),
                "audience", estimate.audienceType().name(),
                "recipients", estimate.recipients(),
                "estimated_seconds", estimate.duration().getSeconds()
        ));
    }

    /**
     * Create a mailing and start sending it in the background
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreateMailingRequest request) {
        Mailing mailing = mailingService.createMailing(
                request.channelId(),
                request.adminId(),
                request.audience() != null ? request.audience() : AudienceType.ALL,
                request.text()
        );
        mailingService.runMailing(mailing.getId());

        log.info("Mailing {} started by admin {}", mailing.getId(), request.adminId());
        return ResponseEntity.ok(Map.of(
                "result", "success",
                "mailing", mapMailingToResponse(mailing)
        ));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> index(@RequestParam Long channelId) {
        List<Map<String, Object>> data = mailingService.getMailings(channelId).stream()
                .map(this::mapMailingToResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("mailings", data));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> show(@PathVariable Long id) {
        Map<String, Object> response = new HashMap<>(mapMailingToResponse(mailingService.getMailing(id)));
        response.put("running", mailingService.isRunning(id));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable Long id) {
        mailingService.cancelMailing(id);
        return ResponseEntity.ok(Map.of("result", "success"));
    }

    private Map<String, Object> mapMailingToResponse(Mailing mailing) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", mailing.getId());
        map.put("channel_id", mailing.getChannelId());
        map.put("admin_id", mailing.getAdminId());
        map.put("audience", mailing.getAudienceType() != null ? mailing.getAudienceType().name() : null);
        map.put("status", mailing.getStatus() != null ? mailing.getStatus().name() : null);
        map.put("total_users", mailing.getTotalUsers());
        map.put("sent_count", mailing.getSentCount());
        map.put("failed_count", mailing.getFailedCount());
        map.put("blocked_count", mailing.getBlockedCount());
        map.put("progress_percent", mailing.getProgressPercent());
        map.put("created_at", mailing.getCreatedAt());
        map.put("finished_at", mailing.getFinishedAt());
        return map;
    }

    public record CreateMailingRequest(
            @NotNull Long channelId,
            @NotNull Long adminId,
            AudienceType audience,
            @NotBlank String text
    ) {}
}
