package com.catalog.picklist.model;

import java.util.Map;

/**
 * One item-level difference between the previous and the new collection of a sync.
 * Values are kept in their flat serialized form so the audit row reads back without type hints.
 */
public record PicklistChange(
        ChangeType type,
        String itemId,
        String itemName,
        Map<String, Object> oldValue,
        Map<String, Object> newValue
) {

    public enum ChangeType {
        ADDED, REMOVED, MODIFIED
    }
}
