package com.catalog.picklist.dto;

import com.catalog.picklist.model.MismatchRecord;
import com.catalog.picklist.model.PicklistType;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over all mismatch records. {@code byType} and {@code bySource} count unresolved
 * records only; {@code byType} always lists all four types.
 */
public record MismatchStats(
        long total,
        long unresolved,
        long resolved,
        Map<PicklistType, Long> byType,
        Map<String, Long> bySource,
        List<MismatchRecord> topUnresolvedByOccurrence,
        List<MismatchRecord> nearMisses
) {
}
