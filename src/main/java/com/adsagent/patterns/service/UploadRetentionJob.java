package com.adsagent.patterns.service;

import com.adsagent.patterns.model.UploadStatus;
import com.adsagent.patterns.repository.UploadAttemptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Deletes finished upload attempts once they expire. Attempts stuck in processing past their expiry
 * are failed first, then removed with the other expired ones; pending attempts are kept.
 */
@Component
public class UploadRetentionJob {

    private static final Logger logger = LoggerFactory.getLogger(UploadRetentionJob.class);

    static final String STALE_MESSAGE = "Processing did not finish - please upload again";

    private static final Set<UploadStatus> TERMINAL = EnumSet.of(UploadStatus.COMPLETED, UploadStatus.FAILED);

    private final UploadAttemptRepository uploadAttemptRepository;
    private final Clock clock;

    public UploadRetentionJob(UploadAttemptRepository uploadAttemptRepository, Clock clock) {
        this.uploadAttemptRepository = uploadAttemptRepository;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.uploads.cleanupIntervalMs:3600000}",
            initialDelayString = "${app.uploads.cleanupIntervalMs:3600000}")
    public void purgeExpired() {
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            int stranded = uploadAttemptRepository.failStale(now, UploadStatus.PROCESSING, UploadStatus.FAILED, STALE_MESSAGE);
            if (stranded > 0) {
                logger.warn("Failed {} upload attempts left in PROCESSING past their expiry", stranded);
            }
            int deleted = uploadAttemptRepository.deleteExpired(now, TERMINAL);
            if (deleted > 0) {
                logger.info("Removed {} expired upload attempts", deleted);
            }
        } catch (DataAccessException e) {
            // Next run retries; a failed sweep must not kill the scheduler thread
            logger.error("Upload retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
