package com.giveawaybot.web.admin;

import com.giveawaybot.domain.admin.entity.Admin;
import com.giveawaybot.domain.admin.service.AdminService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Admin Registry Controller
 * Bot admins: list, add, remove and membership check
 */
@RestController
@RequestMapping("/admin/admins")
@RequiredArgsConstructor
public class AdminRegistryController {

    private final AdminService adminService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> index() {
        List<Map<String, Object>> data = adminService.getAdmins().stream()
                .map(this::mapAdminToResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of(
                "admins", data,
                "total", data.size()
        ));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody AddAdminRequest request) {
        Admin admin = adminService.addAdmin(
                request.userId(),
                request.username(),
                request.firstName(),
                request.fullName()
        );
        return ResponseEntity.ok(Map.of(
                "result", "success",
                "admin", mapAdminToResponse(admin)
        ));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> check(@PathVariable Long userId) {
        return ResponseEntity.ok(Map.of(
                "user_id", userId,
                "is_admin", adminService.isAdmin(userId)
        ));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long userId) {
        adminService.removeAdmin(userId);
        return ResponseEntity.ok(Map.of("result", "success"));
    }

    private Map<String, Object> mapAdminToResponse(Admin admin) {
        Map<String, Object> map = new HashMap<>();
        map.put("user_id", admin.getUserId());
        map.put("username", admin.getUsername());
        map.put("first_name", admin.getFirstName());
        map.put("full_name", admin.getFullName());
        map.put("main_admin", admin.isMainAdmin());
        map.put("created_at", admin.getCreatedAt());
        return map;
    }

    public record AddAdminRequest(
            @NotNull Long userId,
            String username,
            String firstName,
            String fullName
    ) {}
}
