package com.adsagent.patterns.service;

import com.adsagent.patterns.dto.PatternQuery;
import com.adsagent.patterns.model.LearnedPattern;
import com.adsagent.patterns.repository.PatternRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side consumed by the ad generation prompt builder.
 */
@Service
public class PatternRetrievalService {

    private static final Logger logger = LoggerFactory.getLogger(PatternRetrievalService.class);

    private final PatternRepository patternRepository;
    private final RelevanceRanker relevanceRanker;
    private final PromptFormatter promptFormatter;
    private final int defaultLimit;
    private final int maxLimit;

    public PatternRetrievalService(PatternRepository patternRepository,
                                   RelevanceRanker relevanceRanker,
                                   PromptFormatter promptFormatter,
                                   @Value("${app.retrieval.defaultLimit:5}") int defaultLimit,
                                   @Value("${app.retrieval.maxLimit:20}") int maxLimit) {
        this.patternRepository = patternRepository;
        this.relevanceRanker = relevanceRanker;
        this.promptFormatter = promptFormatter;
        this.maxLimit = Math.max(1, maxLimit);
        this.defaultLimit = Math.min(this.maxLimit, Math.max(1, defaultLimit));
    }

    /**
     * Ranks the owner's active patterns against the query.
     */
    public List<LearnedPattern> getRelevantPatterns(PatternQuery query) {
        if (query == null || query.ownerId() == null || query.ownerId().isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        int limit = effectiveLimit(query.limit());
        List<LearnedPattern> active = patternRepository.listActive(query.ownerId());
        List<LearnedPattern> ranked = relevanceRanker.rank(active, query, limit);
        logger.debug("Ranked {} of {} active patterns for owner {} (category={}, platform={}, industry={})",
                ranked.size(), active.size(), query.ownerId(), query.category(), query.platform(), query.industry());
        return ranked;
    }

    public String formatPatternsForPrompt(List<LearnedPattern> patterns) {
        return promptFormatter.format(patterns);
    }

    int effectiveLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(maxLimit, requested));
    }
}
