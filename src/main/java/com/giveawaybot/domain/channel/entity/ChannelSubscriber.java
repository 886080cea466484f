package com.giveawaybot.domain.channel.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Channel member seen through chat_member updates while the bot is a channel admin
 */
@Entity
@Table(name = "channel_subscribers",
        uniqueConstraints = @UniqueConstraint(name = "unique_channel_user", columnNames = {"channel_id", "user_id"}),
        indexes = @Index(name = "idx_channel_subscribers_channel", columnList = "channel_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChannelSubscriber {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    private String username;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "full_name")
    private String fullName;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;

    @Column(name = "left_at")
    private LocalDateTime leftAt;

    @Column(name = "last_activity_at")
    private LocalDateTime lastActivityAt;

    @PrePersist
    protected void onCreate() {
        if (addedAt == null) addedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    public boolean isSubscribed() {
        return leftAt == null;
    }
}
