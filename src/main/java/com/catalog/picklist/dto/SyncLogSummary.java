package com.catalog.picklist.dto;

import com.catalog.picklist.model.PicklistSyncLog;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.model.SyncTypeSummary;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Audit entry without the before-snapshots, for listings.
 */
public record SyncLogSummary(
        String syncId,
        OffsetDateTime timestamp,
        String sourceIp,
        String userAgent,
        long requestBodySize,
        List<PicklistType> typesIncluded,
        boolean success,
        List<String> syncErrors,
        List<SyncTypeSummary> summaries,
        long processingTimeMs
) {

    public static SyncLogSummary from(PicklistSyncLog log) {
        return new SyncLogSummary(
                log.getSyncId(),
                log.getTimestamp(),
                log.getSourceIp(),
                log.getUserAgent(),
                log.getRequestBodySize(),
                log.getTypesIncluded(),
                log.isSuccess(),
                log.getSyncErrors(),
                log.getSummaries(),
                log.getProcessingTimeMs());
    }
}
