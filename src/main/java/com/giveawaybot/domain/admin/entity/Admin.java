package com.giveawaybot.domain.admin.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Telegram user allowed to manage giveaways, channels and mailings
 */
@Entity
@Table(name = "admins")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Admin {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    private String username;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "full_name")
    private String fullName;

    /** Configured through telegram.main-admin-id; cannot be removed. */
    @Column(name = "is_main_admin", nullable = false)
    @Builder.Default
    private Boolean mainAdmin = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
        if (mainAdmin == null) mainAdmin = false;
    }

    public boolean isMainAdmin() {
        return Boolean.TRUE.equals(mainAdmin);
    }
}
