package com.catalog.picklist.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Shared shape of every vocabulary entry. Implementations keep the flat field names of the
 * durable format (brand_id, category_name, ...) for serialization.
 */
public interface PicklistItem {

    @JsonIgnore
    String id();

    @JsonIgnore
    String name();

    /**
     * Names of required fields that are null or blank, in declaration order.
     */
    @JsonIgnore
    List<String> missingFields();

    /**
     * Returns a copy of this entry carrying a different display name.
     */
    PicklistItem withName(String name);

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
