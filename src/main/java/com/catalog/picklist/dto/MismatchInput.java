package com.catalog.picklist.dto;

import com.catalog.picklist.model.ClosestMatch;
import com.catalog.picklist.model.MismatchKey;
import com.catalog.picklist.model.PicklistType;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * One observation of an unmatched value, as buffered before the upsert.
 */
public record MismatchInput(
        PicklistType type,
        String attemptedValue,
        String source,
        String fieldKey,
        double similarity,
        double threshold,
        List<ClosestMatch> closestMatches,
        ProductContext productContext,
        Map<String, Object> aiContext,
        Map<String, Object> rawDataContext,
        OffsetDateTime seenAt
) {

    public MismatchKey key() {
        return MismatchKey.of(type, attemptedValue, source);
    }
}
