package com.adsagent.patterns.dto;

/**
 * Exact-match listing filter; {@code null} fields are ignored.
 */
public record PatternFilter(String category, String platform, String industry, Boolean active) {

    public static PatternFilter none() {
        return new PatternFilter(null, null, null, null);
    }
}
