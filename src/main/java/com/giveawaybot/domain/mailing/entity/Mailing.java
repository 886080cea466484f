package com.giveawaybot.domain.mailing.entity;

import com.giveawaybot.domain.common.enums.AudienceType;
import com.giveawaybot.domain.common.enums.MailingStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Bulk mailing to a channel audience, launched by an admin
 */
@Entity
@Table(name = "mailings", indexes = {
        @Index(name = "idx_mailings_status", columnList = "status"),
        @Index(name = "idx_mailings_channel", columnList = "channel_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Mailing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    @Column(name = "admin_id", nullable = false)
    private Long adminId;

    @Enumerated(EnumType.STRING)
    @Column(name = "audience_type", nullable = false, length = 20)
    private AudienceType audienceType;

    @Column(name = "message_text", nullable = false, columnDefinition = "TEXT")
    private String messageText;

    @Column(name = "total_users", nullable = false)
    @Builder.Default
    private Integer totalUsers = 0;

    @Column(name = "sent_count", nullable = false)
    @Builder.Default
    private Integer sentCount = 0;

    /** Failures other than blocked recipients. */
    @Column(name = "failed_count", nullable = false)
    @Builder.Default
    private Integer failedCount = 0;

    @Column(name = "blocked_count", nullable = false)
    @Builder.Default
    private Integer blockedCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private MailingStatus status = MailingStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
        if (status == null) status = MailingStatus.PENDING;
        if (totalUsers == null) totalUsers = 0;
        if (sentCount == null) sentCount = 0;
        if (failedCount == null) failedCount = 0;
        if (blockedCount == null) blockedCount = 0;
    }

    public int getProgressPercent() {
        if (totalUsers == null || totalUsers == 0) return 100;
        int processed = sentCount + failedCount + blockedCount;
        return (int) ((processed * 100.0) / totalUsers);
    }
}
