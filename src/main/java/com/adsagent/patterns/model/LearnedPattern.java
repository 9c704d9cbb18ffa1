package com.adsagent.patterns.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A stored, abstract description of what made an ad work. Never holds copy, brand names,
 * people descriptions, URLs or numeric claims from the source image.
 */
@Setter
@Getter
@Entity
@Table(name = "learned_ad_patterns",
        uniqueConstraints = @UniqueConstraint(name = LearnedPattern.OWNER_SOURCE_HASH_CONSTRAINT,
                columnNames = {"owner_id", "source_hash"}),
        indexes = {
                @Index(name = "idx_learned_patterns_owner_id", columnList = "owner_id"),
                @Index(name = "idx_learned_patterns_category", columnList = "category"),
                @Index(name = "idx_learned_patterns_platform", columnList = "platform")
        })
public class LearnedPattern {

    public static final String GENERAL_PLATFORM = "general";
    public static final String OWNER_SOURCE_HASH_CONSTRAINT = "learned_ad_patterns_owner_source_hash_unique";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String ownerId;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "platform", nullable = false, length = 50)
    private String platform;

    @Column(name = "industry", length = 100)
    private String industry;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "layout_pattern", columnDefinition = "jsonb")
    private LayoutPattern layoutPattern;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "color_psychology", columnDefinition = "jsonb")
    private ColorPsychology colorPsychology;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "hook_patterns", columnDefinition = "jsonb")
    private HookPattern hookPattern;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "visual_elements", columnDefinition = "jsonb")
    private VisualElements visualElements;

    @Convert(converter = EngagementTierConverter.class)
    @Column(name = "engagement_tier", length = 20)
    private EngagementTier engagementTier;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    // Notes left by extraction/sanitization (clamps, off-vocabulary values, redacted fields)
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extraction_flags", columnDefinition = "jsonb")
    private List<String> extractionFlags = new ArrayList<>();

    @Column(name = "source_hash", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String sourceHash;

    @Column(name = "usage_count", nullable = false)
    private int usageCount = 0;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public LearnedPattern() {
    }

    // Callers stamp both from the injected Clock; this only covers rows built without one.
    // Later changes go through JPQL updates that set updated_at themselves.
    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = OffsetDateTime.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
