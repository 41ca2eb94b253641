package com.catalog.picklist.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record Brand(
        @JsonProperty("brand_id") String brandId,
        @JsonProperty("brand_name") String brandName
) implements PicklistItem {

    @Override
    public String id() {
        return brandId;
    }

    @Override
    public String name() {
        return brandName;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (PicklistItem.isBlank(brandId)) missing.add("brand_id");
        if (PicklistItem.isBlank(brandName)) missing.add("brand_name");
        return missing;
    }

    @Override
    public Brand withName(String name) {
        return new Brand(brandId, name);
    }
}
