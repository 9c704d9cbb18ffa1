package com.adsagent.patterns.repository;

import com.adsagent.patterns.model.PatternApplication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PatternApplicationRepository extends JpaRepository<PatternApplication, UUID> {

    Optional<PatternApplication> findByIdAndOwnerId(UUID id, String ownerId);

    List<PatternApplication> findAllByOwnerIdAndPatternIdOrderByCreatedAtDesc(String ownerId, UUID patternId);
}
