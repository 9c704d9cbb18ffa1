package com.adsagent.patterns.model;

import java.util.List;

/**
 * Verdict of a privacy scan. Not a first-class entity; a copy is kept on the upload attempt for audit.
 */
public record PrivacyScanResult(
        boolean isSafeToProcess,
        boolean hasFaces,
        boolean hasLogos,
        boolean hasContactInfo,
        double textDensity,
        List<String> detectedBrands,
        String rejectionReason,
        List<String> warnings
) {
    public PrivacyScanResult {
        detectedBrands = detectedBrands == null ? List.of() : List.copyOf(detectedBrands);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Fail-closed verdict used when the image could not be analysed at all.
     */
    public static PrivacyScanResult unverified(String reason) {
        return new PrivacyScanResult(false, false, false, false, 0.0, List.of(), reason, List.of());
    }
}
