package com.giveawaybot.web.admin;

import com.giveawaybot.job.GiveawayLifecycleScheduler;
import com.giveawaybot.job.TimerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scheduler Admin Controller
 * Pending timer jobs and reminder flags
 */
@RestController
@RequestMapping("/admin/scheduler")
@RequiredArgsConstructor
public class SchedulerAdminController {

    private final GiveawayLifecycleScheduler lifecycleScheduler;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        TimerStatus status = lifecycleScheduler.status();

        List<Map<String, Object>> jobs = status.jobs().stream()
                .map(job -> {
                    Map<String, Object> map = new HashMap<>();
                    map.put("id", job.key());
                    map.put("description", job.description());
                    map.put("next_run_time", job.nextFireTime().toString());
                    return map;
                })
                .collect(Collectors.toList());

        Map<String, Object> reminders = new HashMap<>();
        lifecycleScheduler.getReminderStates().forEach((giveawayId, state) ->
                reminders.put(String.valueOf(giveawayId), GiveawayAdminController.mapReminderState(state)));

        return ResponseEntity.ok(Map.of(
                "running", status.running(),
                "jobs_count", status.jobsCount(),
                "jobs", jobs,
                "reminders", reminders
        ));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        lifecycleScheduler.cleanupFinishedGiveaways();
        return ResponseEntity.ok(Map.of("result", "success"));
    }
}
