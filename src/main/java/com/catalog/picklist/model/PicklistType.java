package com.catalog.picklist.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four governed vocabularies. Each constant knows its wire name, the plural key used by
 * sync payloads and storage files, its default acceptance thresholds and its item class.
 */
public enum PicklistType {

    BRAND("brand", "brands", 0.70, 0.65, Brand.class),
    CATEGORY("category", "categories", 0.70, 0.65, Category.class),
    STYLE("style", "styles", 0.70, 0.65, Style.class),
    ATTRIBUTE("attribute", "attributes", 0.60, 0.55, Attribute.class);

    private final String wireName;
    private final String collectionKey;
    private final double defaultThreshold;
    private final double partialConfidence;
    private final Class<? extends PicklistItem> itemClass;

    PicklistType(String wireName,
                 String collectionKey,
                 double defaultThreshold,
                 double partialConfidence,
                 Class<? extends PicklistItem> itemClass) {
        this.wireName = wireName;
        this.collectionKey = collectionKey;
        this.defaultThreshold = defaultThreshold;
        this.partialConfidence = partialConfidence;
        this.itemClass = itemClass;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getCollectionKey() {
        return collectionKey;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public double getPartialConfidence() {
        return partialConfidence;
    }

    public Class<? extends PicklistItem> getItemClass() {
        return itemClass;
    }

    /**
     * Resolves a type from a path segment or JSON value. Accepts the singular or plural form
     * in any case ("brand", "Brands", "ATTRIBUTE").
     */
    @JsonCreator
    public static PicklistType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Picklist type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PicklistType type : values()) {
            if (type.wireName.equals(normalized) || type.collectionKey.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown picklist type '" + value
                + "'. Expected one of: brand, category, style, attribute");
    }
}
