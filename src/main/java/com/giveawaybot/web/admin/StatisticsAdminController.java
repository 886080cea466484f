package com.giveawaybot.web.admin;

import com.giveawaybot.domain.statistics.service.StatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Statistics Admin Controller
 * Giveaway, channel and overall reports
 */
@RestController
@RequestMapping("/admin/statistics")
@RequiredArgsConstructor
public class StatisticsAdminController {

    private final StatisticsService statisticsService;

    @GetMapping("/giveaways/{id}")
    public ResponseEntity<Map<String, Object>> giveaway(@PathVariable Long id) {
        return ResponseEntity.ok(statisticsService.giveawayReport(id));
    }

    @GetMapping("/channels/{channelId}")
    public ResponseEntity<Map<String, Object>> channel(
            @PathVariable Long channelId,
            @RequestParam(required = false, defaultValue = "30") int days) {
        return ResponseEntity.ok(statisticsService.channelReport(channelId, days));
    }

    @GetMapping("/overall")
    public ResponseEntity<Map<String, Object>> overall(
            @RequestParam(required = false, defaultValue = "30") int days) {
        return ResponseEntity.ok(statisticsService.overallReport(days));
    }
}
