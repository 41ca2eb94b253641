package com.catalog.picklist.model;

import java.util.List;

/**
 * Per-collection outcome of one sync: counts before and after plus the names that came and went.
 */
public record SyncTypeSummary(
        PicklistType type,
        int previousCount,
        int newCount,
        int itemsAdded,
        int itemsRemoved,
        int itemsModified,
        List<String> addedItems,
        List<String> removedItems
) {
}
