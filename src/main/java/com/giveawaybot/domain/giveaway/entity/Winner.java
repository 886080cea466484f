package com.giveawaybot.domain.giveaway.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Participant drawn into a prize place. Written once when the giveaway finishes.
 */
@Entity
@Table(name = "winners",
        uniqueConstraints = @UniqueConstraint(name = "unique_giveaway_place", columnNames = {"giveaway_id", "place"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Winner {

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

    @Column(nullable = false)
    private Integer place;

    @Column(name = "won_at", nullable = false)
    private LocalDateTime wonAt;

    @PrePersist
    protected void onCreate() {
        if (wonAt == null) wonAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
