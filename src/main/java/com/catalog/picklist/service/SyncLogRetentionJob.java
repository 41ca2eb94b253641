package com.catalog.picklist.service;

import com.catalog.picklist.repository.PicklistSyncLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * Deletes sync audit rows older than the retention window.
 */
@Service
public class SyncLogRetentionJob {

    private static final Logger logger = LoggerFactory.getLogger(SyncLogRetentionJob.class);

    private final PicklistSyncLogRepository repository;
    private final int retentionDays;

    public SyncLogRetentionJob(PicklistSyncLogRepository repository,
                               @Value("${app.picklist.sync.log-retention-days:90}") int retentionDays) {
        this.repository = repository;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${app.picklist.sync.log-retention-cron:0 30 3 * * *}")
    public void scheduledPurge() {
        try {
            purgeExpired();
        } catch (RuntimeException e) {
            logger.error("Sync log retention run failed: {}", e.getMessage(), e);
        }
    }

    public int purgeExpired() {
        if (retentionDays <= 0) {
            return 0;
        }
        OffsetDateTime cutoff = OffsetDateTime.now().minusDays(retentionDays);
        int deleted = repository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            logger.info("Deleted {} sync log(s) older than {} days", deleted, retentionDays);
        }
        return deleted;
    }
}
