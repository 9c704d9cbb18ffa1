package com.adsagent.patterns.repository;

import com.adsagent.patterns.model.EngagementTier;
import com.adsagent.patterns.model.LearnedPattern;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LearnedPatternJpaRepository extends JpaRepository<LearnedPattern, UUID> {

    Optional<LearnedPattern> findByOwnerIdAndSourceHash(String ownerId, String sourceHash);

    Optional<LearnedPattern> findByIdAndOwnerId(UUID id, String ownerId);

    List<LearnedPattern> findAllByOwnerIdAndActiveTrueOrderByCreatedAtDesc(String ownerId);

    @Query("select p from LearnedPattern p where p.ownerId = :ownerId " +
            "and (:category is null or p.category = :category) " +
            "and (:platform is null or p.platform = :platform) " +
            "and (:industry is null or p.industry = :industry) " +
            "and (:active is null or p.active = :active) " +
            "order by p.createdAt desc")
    List<LearnedPattern> findFiltered(@Param("ownerId") String ownerId,
                                      @Param("category") String category,
                                      @Param("platform") String platform,
                                      @Param("industry") String industry,
                                      @Param("active") Boolean active);

    @Transactional
    @Modifying
    @Query("update LearnedPattern p set p.usageCount = p.usageCount + 1, p.lastUsedAt = :usedAt, p.updatedAt = :usedAt " +
            "where p.id = :id and p.ownerId = :ownerId")
    int incrementUsage(@Param("id") UUID id, @Param("ownerId") String ownerId, @Param("usedAt") OffsetDateTime usedAt);

    // Writes the user-editable labels only; usage counters stay owned by incrementUsage
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update LearnedPattern p set p.name = :name, p.category = :category, p.platform = :platform, " +
            "p.industry = :industry, p.engagementTier = :engagementTier, p.active = :active, p.updatedAt = :updatedAt " +
            "where p.id = :id and p.ownerId = :ownerId")
    int updateLabels(@Param("id") UUID id,
                     @Param("ownerId") String ownerId,
                     @Param("name") String name,
                     @Param("category") String category,
                     @Param("platform") String platform,
                     @Param("industry") String industry,
                     @Param("engagementTier") EngagementTier engagementTier,
                     @Param("active") boolean active,
                     @Param("updatedAt") OffsetDateTime updatedAt);

    @Transactional
    long deleteByIdAndOwnerId(UUID id, String ownerId);
}
