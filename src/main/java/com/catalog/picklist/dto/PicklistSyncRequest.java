package com.catalog.picklist.dto;

import com.catalog.picklist.model.Attribute;
import com.catalog.picklist.model.Brand;
import com.catalog.picklist.model.Category;
import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.model.Style;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Bulk replacement payload. Each present collection replaces the stored one wholesale;
 * absent collections are left untouched.
 */
@Data
public class PicklistSyncRequest {

    private List<Brand> brands;
    private List<Category> categories;
    private List<Style> styles;
    private List<Attribute> attributes;

    @JsonIgnore
    public List<? extends PicklistItem> collection(PicklistType type) {
        return switch (type) {
            case BRAND -> brands;
            case CATEGORY -> categories;
            case STYLE -> styles;
            case ATTRIBUTE -> attributes;
        };
    }

    /**
     * Types whose collection is present in the payload, in declaration order.
     */
    @JsonIgnore
    public List<PicklistType> includedTypes() {
        List<PicklistType> included = new ArrayList<>();
        for (PicklistType type : PicklistType.values()) {
            if (collection(type) != null) {
                included.add(type);
            }
        }
        return included;
    }
}
