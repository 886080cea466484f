package com.giveawaybot.domain.giveaway.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "participants",
        uniqueConstraints = @UniqueConstraint(name = "unique_giveaway_participant", columnNames = {"giveaway_id", "user_id"}),
        indexes = @Index(name = "idx_participants_giveaway", columnList = "giveaway_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "giveaway_id", nullable = false)
    private Long giveawayId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    private String username;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "full_name")
    private String fullName;

    @Column(name = "joined_at", nullable = false)
    private LocalDateTime joinedAt;

    @PrePersist
    protected void onCreate() {
        if (joinedAt == null) joinedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
