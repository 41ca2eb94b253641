package com.catalog.picklist.dto;

import com.catalog.picklist.model.ClosestMatch;
import com.catalog.picklist.model.MismatchRecord;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flat projection of a mismatch record for spreadsheets and offline analysis.
 */
public record MismatchExportRow(
        String type,
        String value,
        String normalizedValue,
        String source,
        String fieldKey,
        long occurrences,
        double similarity,
        String closestMatches,
        String productCategory,
        boolean resolved,
        String resolutionAction,
        String resolvedTo,
        OffsetDateTime firstSeen,
        OffsetDateTime lastSeen
) {

    public static MismatchExportRow from(MismatchRecord record) {
        List<ClosestMatch> closest = record.getClosestMatches() == null ? List.of() : record.getClosestMatches();
        return new MismatchExportRow(
                record.getMatchType().getWireName(),
                record.getAttemptedValue(),
                record.getNormalizedValue(),
                record.getSource(),
                record.getFieldKey(),
                record.getOccurrenceCount(),
                record.getSimilarity(),
                closest.stream().map(ClosestMatch::value).collect(Collectors.joining(" | ")),
                record.getProductCategory(),
                record.isResolved(),
                record.getResolutionAction() == null ? null : record.getResolutionAction().getValue(),
                record.getResolvedTo(),
                record.getFirstSeen(),
                record.getLastSeen());
    }
}
