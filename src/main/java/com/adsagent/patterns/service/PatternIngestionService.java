package com.adsagent.patterns.service;

import com.adsagent.patterns.dto.PatternExtractionResult;
import com.adsagent.patterns.dto.PatternMetadata;
import com.adsagent.patterns.model.UploadAttempt;
import com.adsagent.patterns.repository.UploadAttemptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for request-handling code that accepts ad uploads.
 */
@Service
public class PatternIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(PatternIngestionService.class);

    private final UploadAttemptRepository uploadAttemptRepository;
    private final UploadLifecycleTracker uploadLifecycleTracker;
    private final TaskExecutor patternExtractionExecutor;
    private final Clock clock;
    private final long retentionHours;

    public PatternIngestionService(UploadAttemptRepository uploadAttemptRepository,
                                   UploadLifecycleTracker uploadLifecycleTracker,
                                   @Qualifier("patternExtractionExecutor") TaskExecutor patternExtractionExecutor,
                                   Clock clock,
                                   @Value("${app.uploads.retentionHours:24}") long retentionHours) {
        this.uploadAttemptRepository = uploadAttemptRepository;
        this.uploadLifecycleTracker = uploadLifecycleTracker;
        this.patternExtractionExecutor = patternExtractionExecutor;
        this.clock = clock;
        this.retentionHours = Math.max(1, retentionHours);
    }

    /**
     * Records a pending attempt before any bytes are analysed.
     */
    public UploadAttempt createAttempt(String ownerId, String mimeType, long fileSizeBytes) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        UploadAttempt attempt = uploadAttemptRepository.save(
                new UploadAttempt(ownerId, mimeType, fileSizeBytes, now, now.plusHours(retentionHours)));
        logger.info("Created upload attempt {} for owner {}", attempt.getId(), ownerId);
        return attempt;
    }

    public PatternExtractionResult process(UUID uploadId, String ownerId, byte[] imageBytes, String mimeType,
                                           PatternMetadata metadata) {
        return process(uploadId, ownerId, imageBytes, mimeType, metadata, UploadCancellation.none());
    }

    public PatternExtractionResult process(UUID uploadId, String ownerId, byte[] imageBytes, String mimeType,
                                           PatternMetadata metadata, UploadCancellation cancellation) {
        UploadAttempt attempt = uploadAttemptRepository.findByIdAndOwnerId(uploadId, ownerId)
                .orElseThrow(() -> new IllegalArgumentException("Upload " + uploadId + " does not belong to owner " + ownerId));
        return uploadLifecycleTracker.process(attempt, imageBytes, mimeType, metadata, cancellation);
    }

    /**
     * Runs {@link #process} on the pattern extraction pool. Cancel through the token, not the future:
     * cancelling the future does not stop the work.
     */
    public CompletableFuture<PatternExtractionResult> submit(UUID uploadId, String ownerId, byte[] imageBytes,
                                                             String mimeType, PatternMetadata metadata,
                                                             UploadCancellation cancellation) {
        return CompletableFuture.supplyAsync(
                () -> process(uploadId, ownerId, imageBytes, mimeType, metadata, cancellation),
                patternExtractionExecutor);
    }
}
