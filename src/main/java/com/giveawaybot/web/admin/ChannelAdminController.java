package com.giveawaybot.web.admin;

import com.giveawaybot.domain.channel.entity.Channel;
import com.giveawaybot.domain.channel.service.ChannelService;
import com.giveawaybot.domain.giveaway.service.GiveawayManagementService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/admin/channels")
@RequiredArgsConstructor
public class ChannelAdminController {

    private final ChannelService channelService;
    private final GiveawayManagementService managementService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody RegisterChannelRequest request) {
        Channel channel = channelService.registerChannel(
                request.channelId(),
                request.channelName(),
                request.channelUsername(),
                request.discussionGroupId(),
                request.addedBy()
        );
        return ResponseEntity.ok(Map.of(
                "result", "success",
                "channel", mapChannelToResponse(channel)
        ));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> index() {
        List<Map<String, Object>> data = channelService.findAll().stream()
                .map(this::mapChannelToResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("channels", data));
    }

    @GetMapping("/{channelId}")
    public ResponseEntity<Map<String, Object>> show(@PathVariable Long channelId) {
        Map<String, Object> response = new HashMap<>(mapChannelToResponse(channelService.getChannel(channelId)));
        response.put("subscribers_count", channelService.countSubscribers(channelId));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{channelId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long channelId) {
        managementService.removeChannel(channelId);
        return ResponseEntity.ok(Map.of("result", "success"));
    }

    private Map<String, Object> mapChannelToResponse(Channel channel) {
        Map<String, Object> map = new HashMap<>();
        map.put("channel_id", channel.getChannelId());
        map.put("channel_name", channel.getChannelName());
        map.put("channel_username", channel.getChannelUsername());
        map.put("discussion_group_id", channel.getDiscussionGroupId());
        map.put("added_by", channel.getAddedBy());
        map.put("created_at", channel.getCreatedAt());
        return map;
    }

    public record RegisterChannelRequest(
            @NotNull Long channelId,
            @NotBlank String channelName,
            String channelUsername,
            Long discussionGroupId,
            Long addedBy
    ) {}
}
