package com.catalog.picklist.dto;

import java.util.Map;

/**
 * Where a candidate came from. Only {@code source} is required; the rest enriches mismatch records.
 */
public record MatchContext(
        String source,
        String fieldKey,
        ProductContext productContext,
        Map<String, Object> aiContext,
        Map<String, Object> rawDataContext
) {

    public static final String DEFAULT_SOURCE = "api";

    public MatchContext {
        if (source == null || source.isBlank()) {
            source = DEFAULT_SOURCE;
        }
    }

    public static MatchContext of(String source) {
        return new MatchContext(source, null, null, null, null);
    }
}
