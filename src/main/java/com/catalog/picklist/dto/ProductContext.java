package com.catalog.picklist.dto;

/**
 * Product the candidate value came from, copied onto mismatch records for triage.
 */
public record ProductContext(
        String catalogId,
        String catalogName,
        String modelNumber,
        String brand,
        String category,
        String sessionId
) {
}
