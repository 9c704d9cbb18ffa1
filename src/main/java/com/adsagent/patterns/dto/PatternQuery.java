package com.adsagent.patterns.dto;

/**
 * Retrieval context for ranking. Every field but {@code ownerId} is optional;
 * a {@code null} limit falls back to the configured default.
 */
public record PatternQuery(
        String ownerId,
        String category,
        String platform,
        String industry,
        Integer limit
) {
    public static PatternQuery forOwner(String ownerId) {
        return new PatternQuery(ownerId, null, null, null, null);
    }
}
