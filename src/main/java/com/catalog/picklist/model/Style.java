package com.catalog.picklist.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record Style(
        @JsonProperty("style_id") String styleId,
        @JsonProperty("style_name") String styleName
) implements PicklistItem {

    @Override
    public String id() {
        return styleId;
    }

    @Override
    public String name() {
        return styleName;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (PicklistItem.isBlank(styleId)) missing.add("style_id");
        if (PicklistItem.isBlank(styleName)) missing.add("style_name");
        return missing;
    }

    @Override
    public Style withName(String name) {
        return new Style(styleId, name);
    }
}
