package com.adsagent.patterns.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One ingestion attempt. Moves pending -> processing -> completed|failed exactly once;
 * re-processing the same image needs a new attempt.
 */
@Getter
@Entity
@Table(name = "upload_attempts",
        indexes = {
                @Index(name = "idx_uploads_status", columnList = "status"),
                @Index(name = "idx_uploads_expires", columnList = "expires_at"),
                @Index(name = "idx_uploads_owner_id", columnList = "owner_id")
        })
public class UploadAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Setter
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Setter
    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private UploadStatus status = UploadStatus.PENDING;

    @Setter
    @Column(name = "mime_type", length = 100)
    private String mimeType;

    @Setter
    @Column(name = "file_size_bytes")
    private Long fileSizeBytes;

    @Setter
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "privacy_scan_result", columnDefinition = "jsonb")
    private String privacyScanResult; // verdict fields only, serialized by the tracker

    @Column(name = "linked_pattern_id")
    private UUID linkedPatternId;

    @Column(name = "processing_started_at")
    private OffsetDateTime processingStartedAt;

    @Column(name = "processing_completed_at")
    private OffsetDateTime processingCompletedAt;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Setter
    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    public UploadAttempt() {
    }

    public UploadAttempt(String ownerId, String mimeType, Long fileSizeBytes, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.ownerId = ownerId;
        this.mimeType = mimeType;
        this.fileSizeBytes = fileSizeBytes;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = OffsetDateTime.now();
        if (expiresAt == null) expiresAt = createdAt.plusHours(24);
    }

    public void markProcessing(OffsetDateTime now) {
        requireStatus(UploadStatus.PENDING, UploadStatus.PROCESSING);
        this.status = UploadStatus.PROCESSING;
        this.processingStartedAt = now;
    }

    public void complete(UUID patternId, OffsetDateTime now) {
        requireStatus(UploadStatus.PROCESSING, UploadStatus.COMPLETED);
        if (patternId == null) {
            throw new UploadStateException("Completed upload " + id + " must link a pattern");
        }
        this.status = UploadStatus.COMPLETED;
        this.linkedPatternId = patternId;
        finishClock(now);
    }

    public void fail(String message, OffsetDateTime now) {
        requireStatus(UploadStatus.PROCESSING, UploadStatus.FAILED);
        this.status = UploadStatus.FAILED;
        this.errorMessage = (message == null || message.isBlank()) ? "Processing failed" : message;
        finishClock(now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void finishClock(OffsetDateTime now) {
        this.processingCompletedAt = now;
        if (processingStartedAt != null && now != null) {
            this.processingDurationMs = Math.max(0L, Duration.between(processingStartedAt, now).toMillis());
        }
    }

    private void requireStatus(UploadStatus expected, UploadStatus target) {
        if (status != expected) {
            throw new UploadStateException("Upload " + id + " cannot move from " + status + " to " + target);
        }
    }
}
