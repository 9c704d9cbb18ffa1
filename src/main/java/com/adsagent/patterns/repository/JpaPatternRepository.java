package com.adsagent.patterns.repository;

import com.adsagent.patterns.dto.PatternFilter;
import com.adsagent.patterns.model.LearnedPattern;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link PatternRepository} backed by PostgreSQL through Spring Data JPA.
 *
 * The {@code (owner_id, source_hash)} unique constraint is the only dedup guard under concurrency:
 * a violation on insert is reported as {@link DuplicatePatternException}, any other data access
 * failure as {@link RepositoryUnavailableException}.
 */
@Repository
public class JpaPatternRepository implements PatternRepository {

    private static final Logger logger = LoggerFactory.getLogger(JpaPatternRepository.class);

    private final LearnedPatternJpaRepository jpaRepository;
    private final Clock clock;

    public JpaPatternRepository(LearnedPatternJpaRepository jpaRepository, Clock clock) {
        this.jpaRepository = jpaRepository;
        this.clock = clock;
    }

    @Override
    public Optional<LearnedPattern> findByHash(String ownerId, String sourceHash) {
        requireOwner(ownerId);
        return access("findByHash", () -> jpaRepository.findByOwnerIdAndSourceHash(ownerId, sourceHash));
    }

    // REQUIRES_NEW keeps a unique-key violation from poisoning the caller's transaction
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public LearnedPattern create(LearnedPattern pattern) {
        requireOwner(pattern.getOwnerId());
        if (pattern.getId() != null) {
            throw new IllegalArgumentException("New patterns must not carry an id");
        }
        try {
            LearnedPattern saved = jpaRepository.saveAndFlush(pattern);
            logger.info("Created pattern {} for owner {}", saved.getId(), saved.getOwnerId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (!isOwnerSourceHashConflict(e)) {
                logger.error("Pattern for owner {} violates a schema constraint: {}", pattern.getOwnerId(), e.getMessage(), e);
                throw new RepositoryUnavailableException("Pattern rejected by the store during create", e);
            }
            logger.info("Pattern for owner {} and hash {} already exists; deferring to existing row.",
                    pattern.getOwnerId(), pattern.getSourceHash());
            throw new DuplicatePatternException(pattern.getOwnerId(), pattern.getSourceHash(), e);
        } catch (DataAccessException e) {
            logger.error("Failed to persist pattern for owner {}: {}", pattern.getOwnerId(), e.getMessage(), e);
            throw new RepositoryUnavailableException("Pattern store unavailable during create", e);
        }
    }

    @Override
    public Optional<LearnedPattern> findById(String ownerId, UUID patternId) {
        requireOwner(ownerId);
        return access("findById", () -> jpaRepository.findByIdAndOwnerId(patternId, ownerId));
    }

    @Override
    public List<LearnedPattern> listActive(String ownerId) {
        requireOwner(ownerId);
        return access("listActive", () -> jpaRepository.findAllByOwnerIdAndActiveTrueOrderByCreatedAtDesc(ownerId));
    }

    @Override
    public List<LearnedPattern> list(String ownerId, PatternFilter filter) {
        requireOwner(ownerId);
        PatternFilter effective = filter != null ? filter : PatternFilter.none();
        return access("list", () -> jpaRepository.findFiltered(ownerId,
                effective.category(), effective.platform(), effective.industry(), effective.active()));
    }

    // Column-scoped update rather than a merge, so a concurrent touchUsage is never overwritten
    @Override
    @Transactional
    public LearnedPattern update(LearnedPattern pattern) {
        requireOwner(pattern.getOwnerId());
        if (pattern.getId() == null) {
            throw new IllegalArgumentException("Only stored patterns can be updated");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = access("update", () -> jpaRepository.updateLabels(pattern.getId(), pattern.getOwnerId(),
                pattern.getName(), pattern.getCategory(), pattern.getPlatform(), pattern.getIndustry(),
                pattern.getEngagementTier(), pattern.isActive(), now));
        if (updated == 0) {
            throw new IllegalArgumentException("Pattern " + pattern.getId() + " does not belong to owner " + pattern.getOwnerId());
        }
        return access("update", () -> jpaRepository.findByIdAndOwnerId(pattern.getId(), pattern.getOwnerId()))
                .orElseThrow(() -> new IllegalArgumentException("Pattern " + pattern.getId() + " was removed during update"));
    }

    @Override
    public void touchUsage(String ownerId, UUID patternId) {
        requireOwner(ownerId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = access("touchUsage", () -> jpaRepository.incrementUsage(patternId, ownerId, now));
        if (updated == 0) {
            throw new IllegalArgumentException("Pattern " + patternId + " does not belong to owner " + ownerId);
        }
        logger.debug("Recorded usage of pattern {} for owner {}", patternId, ownerId);
    }

    @Override
    public boolean delete(String ownerId, UUID patternId) {
        requireOwner(ownerId);
        long deleted = access("delete", () -> jpaRepository.deleteByIdAndOwnerId(patternId, ownerId));
        return deleted > 0;
    }

    // Only the (owner_id, source_hash) unique key means "already stored"; NOT NULL or length violations do not
    static boolean isOwnerSourceHashConflict(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String constraint = ((ConstraintViolationException) cause).getConstraintName();
                return constraint != null
                        && constraint.toLowerCase(Locale.ROOT).contains(LearnedPattern.OWNER_SOURCE_HASH_CONSTRAINT);
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private <T> T access(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            logger.error("Pattern store {} failed: {}", operation, e.getMessage(), e);
            throw new RepositoryUnavailableException("Pattern store unavailable during " + operation, e);
        }
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
    }
}
