package com.giveawaybot.domain.channel.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Telegram channel where giveaways are published
 */
@Entity
@Table(name = "channels")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Channel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false, unique = true)
    private Long channelId;

    @Column(name = "channel_name", nullable = false)
    private String channelName;

    @Column(name = "channel_username")
    private String channelUsername;

    /** Telegram id of the admin who registered the channel; receives draw summaries. */
    @Column(name = "added_by")
    private Long addedBy;

    @Column(name = "discussion_group_id")
    private Long discussionGroupId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
