package com.adsagent.patterns.dto;

import com.adsagent.patterns.model.LearnedPattern;
import com.adsagent.patterns.model.PrivacyScanResult;

import java.util.UUID;

/**
 * Outcome of one ingestion call.
 *
 * @param isDuplicate       true when an existing pattern with the same fingerprint was linked instead of extracting
 * @param privacyScanResult present whenever the privacy gate ran
 * @param error             human-readable reason, set only when {@code success} is false
 */
public record PatternExtractionResult(
        UUID uploadId,
        boolean success,
        LearnedPattern pattern,
        boolean isDuplicate,
        PrivacyScanResult privacyScanResult,
        String error
) {
    public static PatternExtractionResult created(UUID uploadId, LearnedPattern pattern, PrivacyScanResult scan) {
        return new PatternExtractionResult(uploadId, true, pattern, false, scan, null);
    }

    public static PatternExtractionResult duplicate(UUID uploadId, LearnedPattern existing, PrivacyScanResult scan) {
        return new PatternExtractionResult(uploadId, true, existing, true, scan, null);
    }

    public static PatternExtractionResult failed(UUID uploadId, String error, PrivacyScanResult scan) {
        return new PatternExtractionResult(uploadId, false, null, false, scan, error);
    }
}
