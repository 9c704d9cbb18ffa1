package com.adsagent.patterns.service;

/**
 * One vision-model call: fixed instructions plus an image payload.
 *
 * @param operation short label used in logs ("privacy_scan", "pattern_extraction")
 */
public record VisionRequest(
        String operation,
        String modelId,
        String instructions,
        byte[] image,
        String mimeType,
        double temperature
) {
}
