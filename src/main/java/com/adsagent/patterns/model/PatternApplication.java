package com.adsagent.patterns.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Records that a pattern was fed into a generation, plus the user's later verdict on it.
 */
@Setter
@Getter
@Entity
@Table(name = "pattern_application_history",
        indexes = {
                @Index(name = "idx_history_pattern_id", columnList = "pattern_id"),
                @Index(name = "idx_history_owner_id", columnList = "owner_id")
        })
public class PatternApplication {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String ownerId;

    @Column(name = "pattern_id", nullable = false, updatable = false)
    private UUID patternId;

    @Column(name = "target_platform", length = 50)
    private String targetPlatform;

    @Column(name = "user_rating")
    private Integer userRating;

    @Column(name = "was_used", nullable = false)
    private boolean wasUsed = false;

    @Column(name = "feedback", columnDefinition = "TEXT")
    private String feedback;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = OffsetDateTime.now();
    }
}
