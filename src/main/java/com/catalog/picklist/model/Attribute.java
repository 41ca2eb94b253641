package com.catalog.picklist.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record Attribute(
        @JsonProperty("attribute_id") String attributeId,
        @JsonProperty("attribute_name") String attributeName
) implements PicklistItem {

    @Override
    public String id() {
        return attributeId;
    }

    @Override
    public String name() {
        return attributeName;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (PicklistItem.isBlank(attributeId)) missing.add("attribute_id");
        if (PicklistItem.isBlank(attributeName)) missing.add("attribute_name");
        return missing;
    }

    @Override
    public Attribute withName(String name) {
        return new Attribute(attributeId, name);
    }
}
