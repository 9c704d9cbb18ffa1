package com.adsagent.patterns.service;

import com.adsagent.patterns.dto.PatternQuery;
import com.adsagent.patterns.model.EngagementTier;
import com.adsagent.patterns.model.LearnedPattern;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Additive relevance scoring of stored patterns against a retrieval context.
 * Pure apart from reading the clock; ties keep their input order.
 */
@Service
public class RelevanceRanker {

    static final int CATEGORY_MATCH = 25;
    static final int INDUSTRY_MATCH = 20;
    static final int PLATFORM_MATCH = 15;
    static final int GENERAL_PLATFORM = 5;

    private final Clock clock;

    public RelevanceRanker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns at most {@code limit} active patterns, highest score first.
     */
    public List<LearnedPattern> rank(List<LearnedPattern> patterns, PatternQuery query, int limit) {
        if (patterns == null || patterns.isEmpty() || limit <= 0) {
            return List.of();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Scored> scored = new ArrayList<>(patterns.size());
        for (LearnedPattern pattern : patterns) {
            if (pattern != null && pattern.isActive()) {
                scored.add(new Scored(pattern, score(pattern, query, now)));
            }
        }
        // List.sort is stable, so equal scores keep first-seen order
        scored.sort(Comparator.comparingInt(Scored::score).reversed());
        return scored.stream()
                .limit(limit)
                .map(Scored::pattern)
                .toList();
    }

    int score(LearnedPattern pattern, PatternQuery query, OffsetDateTime now) {
        PatternQuery context = query != null ? query : new PatternQuery(null, null, null, null, null);
        int score = 0;
        if (context.category() != null && Objects.equals(pattern.getCategory(), context.category())) {
            score += CATEGORY_MATCH;
        }
        if (context.industry() != null && Objects.equals(pattern.getIndustry(), context.industry())) {
            score += INDUSTRY_MATCH;
        }
        if (context.platform() != null && Objects.equals(pattern.getPlatform(), context.platform())) {
            score += PLATFORM_MATCH;
        } else if (LearnedPattern.GENERAL_PLATFORM.equals(pattern.getPlatform())) {
            score += GENERAL_PLATFORM;
        }

        EngagementTier tier = pattern.getEngagementTier();
        score += tier != null ? tier.getRankingBonus() : 0;
        score += recencyBonus(pattern.getLastUsedAt(), now);
        score += popularityBonus(pattern.getUsageCount());
        return score;
    }

    private int recencyBonus(OffsetDateTime lastUsedAt, OffsetDateTime now) {
        if (lastUsedAt == null) {
            return 0;
        }
        Duration sinceUse = Duration.between(lastUsedAt, now);
        if (sinceUse.compareTo(Duration.ofDays(7)) < 0) {
            return 10;
        }
        if (sinceUse.compareTo(Duration.ofDays(30)) < 0) {
            return 5;
        }
        return 0;
    }

    private int popularityBonus(int usageCount) {
        if (usageCount > 10) return 5;
        if (usageCount > 5) return 3;
        if (usageCount > 0) return 1;
        return 0;
    }

    private record Scored(LearnedPattern pattern, int score) {
    }
}
