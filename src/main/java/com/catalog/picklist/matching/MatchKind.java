package com.catalog.picklist.matching;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchKind {
    EXACT,
    FUZZY,
    PARTIAL,
    UNMATCHED,
    /** Attribute name with a dedicated first-class field; never a vocabulary member. */
    PRIMARY_ATTRIBUTE,
    /** Looks like an attribute value ("chrome", "24 inches") rather than a name. */
    ATTRIBUTE_VALUE,
    EMPTY;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
