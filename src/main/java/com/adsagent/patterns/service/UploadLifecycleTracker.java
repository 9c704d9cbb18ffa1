package com.adsagent.patterns.service;

import com.adsagent.patterns.dto.PatternExtractionResult;
import com.adsagent.patterns.dto.PatternMetadata;
import com.adsagent.patterns.model.LearnedPattern;
import com.adsagent.patterns.model.PrivacyScanResult;
import com.adsagent.patterns.model.RawPattern;
import com.adsagent.patterns.model.UploadAttempt;
import com.adsagent.patterns.model.UploadStateException;
import com.adsagent.patterns.model.UploadStatus;
import com.adsagent.patterns.repository.DuplicatePatternException;
import com.adsagent.patterns.repository.PatternRepository;
import com.adsagent.patterns.repository.RepositoryUnavailableException;
import com.adsagent.patterns.repository.UploadAttemptRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Drives one {@link UploadAttempt} from pending to completed or failed:
 * fingerprint, dedup lookup, privacy gate, extraction, sanitization, create.
 *
 * Every path ends in a terminal state. Failures of the model, the response format or the store
 * become a failed attempt with a readable message; anything unexpected is caught here and becomes
 * a generic failure.
 */
@Service
public class UploadLifecycleTracker {

    private static final Logger logger = LoggerFactory.getLogger(UploadLifecycleTracker.class);

    static final String MODEL_UNAVAILABLE_MESSAGE = "Pattern extraction failed - model service unavailable, please try again later";
    static final String STORE_UNAVAILABLE_MESSAGE = "Pattern storage is unavailable, please try again later";
    static final String CANCELLED_MESSAGE = "Upload cancelled before completion";
    static final String GENERIC_FAILURE_MESSAGE = "Unexpected error while processing upload";

    private final ContentHashingService contentHashingService;
    private final PatternRepository patternRepository;
    private final UploadAttemptRepository uploadAttemptRepository;
    private final PrivacyGate privacyGate;
    private final PatternExtractor patternExtractor;
    private final PatternSanitizer patternSanitizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UploadLifecycleTracker(ContentHashingService contentHashingService,
                                  PatternRepository patternRepository,
                                  UploadAttemptRepository uploadAttemptRepository,
                                  PrivacyGate privacyGate,
                                  PatternExtractor patternExtractor,
                                  PatternSanitizer patternSanitizer,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.contentHashingService = contentHashingService;
        this.patternRepository = patternRepository;
        this.uploadAttemptRepository = uploadAttemptRepository;
        this.privacyGate = privacyGate;
        this.patternExtractor = patternExtractor;
        this.patternSanitizer = patternSanitizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Processes a pending attempt to completion.
     *
     * @throws UploadStateException if the attempt is not pending
     */
    public PatternExtractionResult process(UploadAttempt attempt,
                                           byte[] imageBytes,
                                           String mimeType,
                                           PatternMetadata metadata,
                                           UploadCancellation cancellation) {
        if (attempt.getStatus() != UploadStatus.PENDING) {
            throw new UploadStateException("Upload " + attempt.getId() + " is " + attempt.getStatus() + "; a new attempt is required");
        }
        UploadCancellation token = cancellation != null ? cancellation : UploadCancellation.none();

        attempt.markProcessing(now());
        uploadAttemptRepository.save(attempt);
        logger.info("Processing upload {} for owner {} ({}, {} bytes)",
                attempt.getId(), attempt.getOwnerId(), mimeType, imageBytes == null ? 0 : imageBytes.length);

        try {
            return runPipeline(attempt, imageBytes, mimeType, metadata, token);
        } catch (RepositoryUnavailableException e) {
            logger.error("Upload {} failed: pattern store unavailable: {}", attempt.getId(), e.getMessage());
            return fail(attempt, STORE_UNAVAILABLE_MESSAGE, null);
        } catch (RuntimeException e) {
            if (attempt.isTerminal()) {
                // The outcome was decided but could not be recorded; the stored row is still processing
                logger.error("Upload {} of owner {} reached {} but the state could not be saved; stored row left in PROCESSING until the retention sweep fails it",
                        attempt.getId(), attempt.getOwnerId(), attempt.getStatus(), e);
                throw e;
            }
            logger.error("Upload {} failed with an unexpected error", attempt.getId(), e);
            return fail(attempt, GENERIC_FAILURE_MESSAGE, null);
        }
    }

    private PatternExtractionResult runPipeline(UploadAttempt attempt,
                                                byte[] imageBytes,
                                                String mimeType,
                                                PatternMetadata metadata,
                                                UploadCancellation cancellation) {
        String ownerId = attempt.getOwnerId();
        String sourceHash = contentHashingService.hash(imageBytes);

        Optional<LearnedPattern> existing = patternRepository.findByHash(ownerId, sourceHash);
        if (existing.isPresent()) {
            logger.info("Upload {} matches existing pattern {} for owner {}; skipping analysis",
                    attempt.getId(), existing.get().getId(), ownerId);
            return completeDuplicate(attempt, existing.get(), null);
        }

        if (cancellation.isCancelled()) {
            return fail(attempt, CANCELLED_MESSAGE, null);
        }
        PrivacyScanResult scan = privacyGate.scan(imageBytes, mimeType);
        attempt.setPrivacyScanResult(toJson(scan));
        logger.info("Privacy verdict for upload {} of owner {}: safe={}, faces={}, brands={}",
                attempt.getId(), ownerId, scan.isSafeToProcess(), scan.hasFaces(), scan.detectedBrands().size());
        if (!scan.isSafeToProcess()) {
            logger.warn("Upload {} rejected by privacy gate: {}", attempt.getId(), scan.rejectionReason());
            return fail(attempt, scan.rejectionReason(), scan);
        }

        if (cancellation.isCancelled()) {
            return fail(attempt, CANCELLED_MESSAGE, scan);
        }
        RawPattern sanitized;
        try {
            sanitized = patternSanitizer.sanitize(patternExtractor.extract(imageBytes, mimeType));
        } catch (ModelTransportException e) {
            logger.error("Upload {} failed: model unavailable (retries exhausted: {}): {}",
                    attempt.getId(), e.isRetriesExhausted(), e.getMessage());
            return fail(attempt, MODEL_UNAVAILABLE_MESSAGE, scan);
        } catch (ExtractionMalformedException e) {
            logger.error("Upload {} failed: malformed extraction response: {}", attempt.getId(), e.getResponseExcerpt());
            return fail(attempt, e.getMessage(), scan);
        }

        if (cancellation.isCancelled()) {
            return fail(attempt, CANCELLED_MESSAGE, scan);
        }
        LearnedPattern candidate = toPattern(ownerId, sourceHash, metadata, sanitized);
        try {
            LearnedPattern created = patternRepository.create(candidate);
            return complete(attempt, created, scan);
        } catch (DuplicatePatternException e) {
            // A concurrent identical upload won the insert
            Optional<LearnedPattern> winner = patternRepository.findByHash(ownerId, sourceHash);
            if (winner.isEmpty()) {
                logger.error("Upload {} hit a duplicate key but no pattern exists for hash {}", attempt.getId(), sourceHash);
                return fail(attempt, STORE_UNAVAILABLE_MESSAGE, scan);
            }
            logger.info("Upload {} lost the create race; linking existing pattern {}", attempt.getId(), winner.get().getId());
            return completeDuplicate(attempt, winner.get(), scan);
        } catch (RepositoryUnavailableException e) {
            logger.error("Upload {} failed: pattern store unavailable: {}", attempt.getId(), e.getMessage());
            return fail(attempt, STORE_UNAVAILABLE_MESSAGE, scan);
        }
    }

    private LearnedPattern toPattern(String ownerId, String sourceHash, PatternMetadata metadata, RawPattern sanitized) {
        LearnedPattern pattern = new LearnedPattern();
        pattern.setOwnerId(ownerId);
        pattern.setName(metadata.name());
        pattern.setCategory(metadata.category());
        pattern.setPlatform(metadata.platform());
        pattern.setIndustry(metadata.industry());
        pattern.setEngagementTier(metadata.engagementTier());
        pattern.setLayoutPattern(sanitized.layoutPattern());
        pattern.setColorPsychology(sanitized.colorPsychology());
        pattern.setHookPattern(sanitized.hookPattern());
        pattern.setVisualElements(sanitized.visualElements());
        pattern.setConfidenceScore(sanitized.confidenceScore());
        pattern.setExtractionFlags(new ArrayList<>(sanitized.flags()));
        pattern.setSourceHash(sourceHash);
        OffsetDateTime now = now();
        pattern.setCreatedAt(now);
        pattern.setUpdatedAt(now);
        return pattern;
    }

    private PatternExtractionResult complete(UploadAttempt attempt, LearnedPattern pattern, PrivacyScanResult scan) {
        attempt.complete(pattern.getId(), now());
        uploadAttemptRepository.save(attempt);
        logger.info("Upload {} completed with new pattern {} in {} ms",
                attempt.getId(), pattern.getId(), attempt.getProcessingDurationMs());
        return PatternExtractionResult.created(attempt.getId(), pattern, scan);
    }

    private PatternExtractionResult completeDuplicate(UploadAttempt attempt, LearnedPattern existing, PrivacyScanResult scan) {
        attempt.complete(existing.getId(), now());
        uploadAttemptRepository.save(attempt);
        logger.info("Upload {} completed as duplicate of pattern {} in {} ms",
                attempt.getId(), existing.getId(), attempt.getProcessingDurationMs());
        return PatternExtractionResult.duplicate(attempt.getId(), existing, scan);
    }

    private PatternExtractionResult fail(UploadAttempt attempt, String message, PrivacyScanResult scan) {
        attempt.fail(message, now());
        uploadAttemptRepository.save(attempt);
        logger.info("Upload {} failed in {} ms: {}", attempt.getId(), attempt.getProcessingDurationMs(), attempt.getErrorMessage());
        return PatternExtractionResult.failed(attempt.getId(), attempt.getErrorMessage(), scan);
    }

    private String toJson(PrivacyScanResult scan) {
        try {
            return objectMapper.writeValueAsString(scan);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize privacy verdict for audit: {}", e.getMessage());
            return null;
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
