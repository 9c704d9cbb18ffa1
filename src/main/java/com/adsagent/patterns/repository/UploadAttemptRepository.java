package com.adsagent.patterns.repository;

import com.adsagent.patterns.model.UploadAttempt;
import com.adsagent.patterns.model.UploadStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UploadAttemptRepository extends JpaRepository<UploadAttempt, UUID> {

    Optional<UploadAttempt> findByIdAndOwnerId(UUID id, String ownerId);

    /**
     * Fails attempts still in {@code status} after their expiry, e.g. when the terminal save was lost.
     * Returns the number of attempts moved.
     */
    @Transactional
    @Modifying
    @Query("update UploadAttempt u set u.status = :failed, u.errorMessage = :message, u.processingCompletedAt = :now " +
            "where u.expiresAt <= :now and u.status = :status")
    int failStale(@Param("now") OffsetDateTime now,
                  @Param("status") UploadStatus status,
                  @Param("failed") UploadStatus failed,
                  @Param("message") String message);

    /**
     * Removes expired attempts in the given (terminal) statuses; returns the number deleted.
     */
    @Transactional
    @Modifying
    @Query("delete from UploadAttempt u where u.expiresAt <= :cutoff and u.status in :statuses")
    int deleteExpired(@Param("cutoff") OffsetDateTime cutoff, @Param("statuses") Collection<UploadStatus> statuses);
}
