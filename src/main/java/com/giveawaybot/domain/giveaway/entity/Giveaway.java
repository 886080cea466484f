package com.giveawaybot.domain.giveaway.entity;

import com.giveawaybot.domain.common.enums.GiveawayStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Giveaway published in a channel. All timestamps are UTC.
 */
@Entity
@Table(name = "giveaways", indexes = {
        @Index(name = "idx_giveaways_status", columnList = "status"),
        @Index(name = "idx_giveaways_channel", columnList = "channel_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Giveaway {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    /** Direct message for winners; supports {place} and {title}. */
    @Column(name = "message_winner", columnDefinition = "TEXT")
    private String messageWinner;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    /** Id of the giveaway post in the channel; announcements reply to it. */
    @Column(name = "message_id")
    private Long messageId;

    @Column(name = "start_time")
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private GiveawayStatus status = GiveawayStatus.ACTIVE;

    @Column(name = "winner_places", nullable = false)
    @Builder.Default
    private Integer winnerPlaces = 1;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
        updatedAt = createdAt;
        if (startTime == null) startTime = createdAt;
        if (status == null) status = GiveawayStatus.ACTIVE;
        if (winnerPlaces == null) winnerPlaces = 1;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public Instant getEndInstant() {
        return endTime.toInstant(ZoneOffset.UTC);
    }
}
