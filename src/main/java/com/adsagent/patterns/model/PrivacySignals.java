package com.adsagent.patterns.model;

import java.util.List;

/**
 * Raw privacy findings reported by the vision model for one image. Transient: the detected text
 * is only used for blocklist and contact checks and is never persisted or logged.
 */
public record PrivacySignals(
        double textDensity,
        List<String> detectedText,
        boolean hasLogos,
        List<String> logoDescriptions,
        boolean hasFaces,
        int faceCount,
        boolean hasContactInfo
) {
    public PrivacySignals {
        detectedText = detectedText == null ? List.of() : List.copyOf(detectedText);
        logoDescriptions = logoDescriptions == null ? List.of() : List.copyOf(logoDescriptions);
    }
}
