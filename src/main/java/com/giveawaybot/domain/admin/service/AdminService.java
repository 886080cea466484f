package com.giveawaybot.domain.admin.service;

import com.giveawaybot.domain.admin.entity.Admin;
import com.giveawaybot.domain.admin.repository.AdminRepository;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Admin registry. The main admin comes from configuration and is registered at startup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final AdminRepository adminRepository;

    @Value("${telegram.main-admin-id:#{null}}")
    private Long mainAdminId;

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureMainAdmin() {
        if (mainAdminId == null) {
            log.warn("telegram.main-admin-id is not set, no main admin registered");
            return;
        }
        Admin admin = adminRepository.findByUserId(mainAdminId)
                .orElseGet(() -> Admin.builder().userId(mainAdminId).build());
        if (admin.getId() == null || !admin.isMainAdmin()) {
            admin.setMainAdmin(true);
            adminRepository.save(admin);
            log.info("Main admin {} registered", mainAdminId);
        }
    }

    public boolean isAdmin(Long userId) {
        return userId != null && adminRepository.existsByUserId(userId);
    }

    public void requireAdmin(Long userId) {
        if (!isAdmin(userId)) {
            throw new BusinessException("User " + userId + " is not an admin");
        }
    }

    public List<Admin> getAdmins() {
        return adminRepository.findAllByOrderByCreatedAtAsc();
    }

    @Transactional
    public Admin addAdmin(Long userId, String username, String firstName, String fullName) {
        if (userId == null) {
            throw new BusinessException("user_id is required");
        }
        if (adminRepository.existsByUserId(userId)) {
            throw new BusinessException("User " + userId + " is already an admin");
        }

        Admin admin = adminRepository.save(Admin.builder()
                .userId(userId)
                .username(username)
                .firstName(firstName)
                .fullName(fullName)
                .mainAdmin(false)
                .build());
        log.info("Admin {} added", userId);
        return admin;
    }

    @Transactional
    public void removeAdmin(Long userId) {
        Admin admin = adminRepository.findByUserId(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Admin", userId));
        if (admin.isMainAdmin()) {
            throw new BusinessException("The main admin cannot be removed");
        }
        adminRepository.delete(admin);
        log.info("Admin {} removed", userId);
    }
}
