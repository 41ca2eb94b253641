package com.catalog.picklist.dto;

import com.catalog.picklist.model.PicklistType;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Set;

/**
 * Filter, sort and paging options for listing mismatch records. Every filter is optional.
 */
@Getter
@Builder
public class MismatchQuery {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;
    public static final String DEFAULT_SORT = "occurrenceCount";

    private static final Set<String> SORTABLE = Set.of("occurrenceCount", "lastSeen", "firstSeen", "similarity");

    private final PicklistType type;
    private final String source;
    private final Boolean resolved;
    private final String category;
    private final Long minOccurrences;
    private final Double minSimilarity;
    private final Double maxSimilarity;
    private final OffsetDateTime lastSeenFrom;
    private final OffsetDateTime lastSeenTo;
    private final Integer skip;
    private final Integer limit;
    private final String sortBy;
    private final String sortOrder;

    public int effectiveSkip() {
        return skip == null ? 0 : Math.max(0, skip);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    /**
     * Entity property to order by; unknown names fall back to occurrence count.
     */
    public String effectiveSortBy() {
        return sortBy != null && SORTABLE.contains(sortBy) ? sortBy : DEFAULT_SORT;
    }

    public boolean ascending() {
        return sortOrder != null && sortOrder.toLowerCase(Locale.ROOT).startsWith("asc");
    }
}
