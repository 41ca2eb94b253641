package com.catalog.picklist.dto;

import com.catalog.picklist.model.SyncTypeSummary;

import java.util.List;

/**
 * @param success true only when every included collection was replaced
 * @param partial true when some, but not all, collections were replaced
 */
public record PicklistSyncResult(
        String syncId,
        boolean success,
        boolean partial,
        List<SyncTypeSummary> updated,
        List<String> errors,
        long processingTimeMs
) {
}
