package com.adsagent.patterns.dto;

import com.adsagent.patterns.model.EngagementTier;

/**
 * Caller-supplied labels for an upload. None of these are inferred from the image.
 *
 * @param industry       optional
 * @param engagementTier optional; {@code null} ranks like unverified
 */
public record PatternMetadata(
        String name,
        String category,
        String platform,
        String industry,
        EngagementTier engagementTier
) {
    public PatternMetadata {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pattern name is required");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Pattern category is required");
        }
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("Pattern platform is required");
        }
        name = name.trim();
        if (name.length() > 100) {
            throw new IllegalArgumentException("Pattern name must be at most 100 characters");
        }
    }
}
