package com.adsagent.patterns.repository;

import com.adsagent.patterns.dto.PatternFilter;
import com.adsagent.patterns.model.LearnedPattern;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage port for learned patterns. Every operation is scoped by owner; asking for another
 * owner's pattern is a programming error and raises {@link IllegalArgumentException}.
 * Implementations must enforce uniqueness of {@code (ownerId, sourceHash)}.
 */
public interface PatternRepository {

    /**
     * Dedup lookup by content fingerprint.
     */
    Optional<LearnedPattern> findByHash(String ownerId, String sourceHash);

    /**
     * Inserts a new pattern.
     *
     * @throws DuplicatePatternException      if the owner already has a pattern for the same fingerprint
     * @throws RepositoryUnavailableException when the store cannot be reached
     */
    LearnedPattern create(LearnedPattern pattern);

    Optional<LearnedPattern> findById(String ownerId, UUID patternId);

    /**
     * Active patterns of an owner, newest first.
     */
    List<LearnedPattern> listActive(String ownerId);

    List<LearnedPattern> list(String ownerId, PatternFilter filter);

    /**
     * Persists the user-editable labels (name, category, platform, industry, engagement tier,
     * active flag) of an existing pattern. Extracted fields and usage counters are not written.
     *
     * @return the stored pattern as re-read after the update
     */
    LearnedPattern update(LearnedPattern pattern);

    /**
     * Increments {@code usageCount} and stamps {@code lastUsedAt} in a single store-side update.
     */
    void touchUsage(String ownerId, UUID patternId);

    /**
     * Hard delete. Returns false when the owner has no such pattern.
     */
    boolean delete(String ownerId, UUID patternId);
}
