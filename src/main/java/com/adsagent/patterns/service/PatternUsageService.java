package com.adsagent.patterns.service;

import com.adsagent.patterns.model.PatternApplication;
import com.adsagent.patterns.repository.PatternApplicationRepository;
import com.adsagent.patterns.repository.PatternRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Records that patterns were applied to a generation and collects user ratings of the result.
 */
@Service
public class PatternUsageService {

    private static final Logger logger = LoggerFactory.getLogger(PatternUsageService.class);

    private final PatternRepository patternRepository;
    private final PatternApplicationRepository patternApplicationRepository;
    private final Clock clock;

    public PatternUsageService(PatternRepository patternRepository,
                               PatternApplicationRepository patternApplicationRepository,
                               Clock clock) {
        this.patternRepository = patternRepository;
        this.patternApplicationRepository = patternApplicationRepository;
        this.clock = clock;
    }

    /**
     * Bumps the pattern's usage counters and writes a history row.
     *
     * @throws IllegalArgumentException if the pattern does not belong to the owner
     */
    @Transactional
    public PatternApplication recordApplication(String ownerId, UUID patternId, String targetPlatform) {
        patternRepository.touchUsage(ownerId, patternId);
        PatternApplication application = new PatternApplication();
        application.setOwnerId(ownerId);
        application.setPatternId(patternId);
        application.setTargetPlatform(targetPlatform);
        application.setCreatedAt(OffsetDateTime.now(clock));
        PatternApplication saved = patternApplicationRepository.save(application);
        logger.info("Recorded application {} of pattern {} for owner {}", saved.getId(), patternId, ownerId);
        return saved;
    }

    @Transactional
    public PatternApplication rate(String ownerId, UUID applicationId, int rating, boolean wasUsed, String feedback) {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5");
        }
        PatternApplication application = patternApplicationRepository.findByIdAndOwnerId(applicationId, ownerId)
                .orElseThrow(() -> new IllegalArgumentException("Application " + applicationId + " does not belong to owner " + ownerId));
        application.setUserRating(rating);
        application.setWasUsed(wasUsed);
        application.setFeedback(feedback == null || feedback.isBlank() ? null : feedback.trim());
        return patternApplicationRepository.save(application);
    }

    /**
     * Application history of one pattern, newest first.
     */
    public List<PatternApplication> history(String ownerId, UUID patternId) {
        return patternApplicationRepository.findAllByOwnerIdAndPatternIdOrderByCreatedAtDesc(ownerId, patternId);
    }
}
