package com.catalog.picklist.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Category entry. Department and family are required in addition to id and name.
 */
public record Category(
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("category_name") String categoryName,
        @JsonProperty("department") String department,
        @JsonProperty("family") String family
) implements PicklistItem {

    @Override
    public String id() {
        return categoryId;
    }

    @Override
    public String name() {
        return categoryName;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (PicklistItem.isBlank(categoryId)) missing.add("category_id");
        if (PicklistItem.isBlank(categoryName)) missing.add("category_name");
        if (PicklistItem.isBlank(department)) missing.add("department");
        if (PicklistItem.isBlank(family)) missing.add("family");
        return missing;
    }

    @Override
    public Category withName(String name) {
        return new Category(categoryId, name, department, family);
    }
}
