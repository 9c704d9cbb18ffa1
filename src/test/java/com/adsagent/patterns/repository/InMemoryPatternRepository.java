package com.adsagent.patterns.repository;

import com.adsagent.patterns.dto.PatternFilter;
import com.adsagent.patterns.model.LearnedPattern;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed store that enforces the (owner, source hash) uniqueness the database would.
 */
public class InMemoryPatternRepository implements PatternRepository {

    private final Map<UUID, LearnedPattern> patterns = new ConcurrentHashMap<>();
    private final AtomicInteger createCalls = new AtomicInteger();

    @Override
    public Optional<LearnedPattern> findByHash(String ownerId, String sourceHash) {
        return patterns.values().stream()
                .filter(p -> p.getOwnerId().equals(ownerId) && p.getSourceHash().equals(sourceHash))
                .findFirst();
    }

    @Override
    public synchronized LearnedPattern create(LearnedPattern pattern) {
        createCalls.incrementAndGet();
        if (findByHash(pattern.getOwnerId(), pattern.getSourceHash()).isPresent()) {
            throw new DuplicatePatternException(pattern.getOwnerId(), pattern.getSourceHash(), null);
        }
        pattern.setId(UUID.randomUUID());
        if (pattern.getCreatedAt() == null) {
            pattern.setCreatedAt(OffsetDateTime.now());
        }
        pattern.setUpdatedAt(pattern.getCreatedAt());
        patterns.put(pattern.getId(), pattern);
        return pattern;
    }

    @Override
    public Optional<LearnedPattern> findById(String ownerId, UUID patternId) {
        return Optional.ofNullable(patterns.get(patternId)).filter(p -> p.getOwnerId().equals(ownerId));
    }

    @Override
    public List<LearnedPattern> listActive(String ownerId) {
        return list(ownerId, new PatternFilter(null, null, null, true));
    }

    @Override
    public List<LearnedPattern> list(String ownerId, PatternFilter filter) {
        PatternFilter f = filter != null ? filter : PatternFilter.none();
        List<LearnedPattern> result = new ArrayList<>();
        for (LearnedPattern p : patterns.values()) {
            if (p.getOwnerId().equals(ownerId)
                    && (f.category() == null || f.category().equals(p.getCategory()))
                    && (f.platform() == null || f.platform().equals(p.getPlatform()))
                    && (f.industry() == null || f.industry().equals(p.getIndustry()))
                    && (f.active() == null || f.active() == p.isActive())) {
                result.add(p);
            }
        }
        result.sort(Comparator.comparing(LearnedPattern::getCreatedAt).reversed());
        return result;
    }

    @Override
    public LearnedPattern update(LearnedPattern pattern) {
        LearnedPattern stored = findById(pattern.getOwnerId(), Objects.requireNonNull(pattern.getId()))
                .orElseThrow(() -> new IllegalArgumentException("Pattern " + pattern.getId() + " does not belong to owner " + pattern.getOwnerId()));
        stored.setName(pattern.getName());
        stored.setCategory(pattern.getCategory());
        stored.setPlatform(pattern.getPlatform());
        stored.setIndustry(pattern.getIndustry());
        stored.setEngagementTier(pattern.getEngagementTier());
        stored.setActive(pattern.isActive());
        return stored;
    }

    @Override
    public void touchUsage(String ownerId, UUID patternId) {
        LearnedPattern pattern = findById(ownerId, patternId)
                .orElseThrow(() -> new IllegalArgumentException("Pattern " + patternId + " does not belong to owner " + ownerId));
        pattern.setUsageCount(pattern.getUsageCount() + 1);
        pattern.setLastUsedAt(OffsetDateTime.now());
    }

    @Override
    public boolean delete(String ownerId, UUID patternId) {
        return findById(ownerId, patternId).map(p -> patterns.remove(p.getId()) != null).orElse(false);
    }

    public int size() {
        return patterns.size();
    }

    public int createCalls() {
        return createCalls.get();
    }

    /**
     * Inserts a row directly, as a concurrent upload would have.
     */
    public LearnedPattern seed(LearnedPattern pattern) {
        return create(pattern);
    }
}
