package com.adsagent.patterns.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordinal performance label supplied by the uploader: top-1 > top-5 > top-10 > top-25 > unverified.
 */
public enum EngagementTier {
    TOP_1("top-1", 15),
    TOP_5("top-5", 12),
    TOP_10("top-10", 8),
    TOP_25("top-25", 4),
    UNVERIFIED("unverified", 0);

    private final String value;
    private final int rankingBonus;

    EngagementTier(String value, int rankingBonus) {
        this.value = value;
        this.rankingBonus = rankingBonus;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRankingBonus() {
        return rankingBonus;
    }

    public boolean isVerified() {
        return this != UNVERIFIED;
    }

    /**
     * Resolves the wire value ("top-5") or the constant name ("TOP_5"); blank input yields {@code null}.
     */
    @JsonCreator
    public static EngagementTier fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (EngagementTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown engagement tier: " + raw);
    }
}
