package com.adsagent.patterns.service;

import com.adsagent.patterns.dto.PatternFilter;
import com.adsagent.patterns.dto.PatternUpdateRequest;
import com.adsagent.patterns.model.LearnedPattern;
import com.adsagent.patterns.repository.PatternRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner-facing management of stored patterns. Only the user-supplied labels can change;
 * extracted fields and the source fingerprint are fixed at creation.
 */
@Service
public class PatternLibraryService {

    private static final Logger logger = LoggerFactory.getLogger(PatternLibraryService.class);

    private final PatternRepository patternRepository;

    public PatternLibraryService(PatternRepository patternRepository) {
        this.patternRepository = patternRepository;
    }

    public Optional<LearnedPattern> findById(String ownerId, UUID patternId) {
        return patternRepository.findById(ownerId, patternId);
    }

    public List<LearnedPattern> list(String ownerId, PatternFilter filter) {
        return patternRepository.list(ownerId, filter);
    }

    public LearnedPattern update(String ownerId, UUID patternId, PatternUpdateRequest changes) {
        LearnedPattern pattern = require(ownerId, patternId);
        if (changes == null) {
            return pattern;
        }
        if (changes.getName() != null) {
            String name = changes.getName().trim();
            if (name.isEmpty() || name.length() > 100) {
                throw new IllegalArgumentException("Pattern name must be 1 to 100 characters");
            }
            pattern.setName(name);
        }
        if (changes.getCategory() != null) {
            pattern.setCategory(requireText(changes.getCategory(), "category"));
        }
        if (changes.getPlatform() != null) {
            pattern.setPlatform(requireText(changes.getPlatform(), "platform"));
        }
        if (changes.getIndustry() != null) {
            pattern.setIndustry(changes.getIndustry().isBlank() ? null : changes.getIndustry().trim());
        }
        if (changes.getEngagementTier() != null) {
            pattern.setEngagementTier(changes.getEngagementTier());
        }
        if (changes.getActive() != null) {
            pattern.setActive(changes.getActive());
        }
        LearnedPattern saved = patternRepository.update(pattern);
        logger.info("Updated pattern {} for owner {}", patternId, ownerId);
        return saved;
    }

    /**
     * Soft delete: the pattern stays stored but no longer ranks.
     */
    public LearnedPattern deactivate(String ownerId, UUID patternId) {
        return update(ownerId, patternId, PatternUpdateRequest.builder().active(false).build());
    }

    public boolean delete(String ownerId, UUID patternId) {
        boolean deleted = patternRepository.delete(ownerId, patternId);
        if (deleted) {
            logger.info("Deleted pattern {} for owner {}", patternId, ownerId);
        }
        return deleted;
    }

    private LearnedPattern require(String ownerId, UUID patternId) {
        return patternRepository.findById(ownerId, patternId)
                .orElseThrow(() -> new IllegalArgumentException("Pattern " + patternId + " does not belong to owner " + ownerId));
    }

    private static String requireText(String value, String field) {
        if (value.isBlank()) {
            throw new IllegalArgumentException("Pattern " + field + " must not be blank");
        }
        return value.trim();
    }
}
