package com.catalog.picklist.dto;

import java.util.Map;

/**
 * @param counts             entries per collection key ("brands", "categories", ...)
 * @param pendingMismatches  observations buffered but not yet written
 * @param initialized        true once every collection loaded successfully
 */
public record PicklistStats(Map<String, Integer> counts, int pendingMismatches, boolean initialized) {
}
