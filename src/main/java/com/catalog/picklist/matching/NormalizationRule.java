package com.catalog.picklist.matching;

import com.catalog.picklist.model.PicklistType;

import java.util.Locale;

/**
 * How candidates and vocabulary names are canonicalized before comparison, per picklist type.
 *
 * <pre>
 * type       case fold   strip diacritics   aliases
 * brand      upper       yes                no
 * category   lower       no                 yes
 * style      lower       no                 no
 * attribute  lower       no                 yes
 * </pre>
 *
 * Diacritics are stripped for brands only. Whether categories, styles and attributes should get
 * the same treatment is an open product decision, so the asymmetry is kept explicit here.
 */
public enum NormalizationRule {

    BRAND(true, true),
    CATEGORY(false, false),
    STYLE(false, false),
    ATTRIBUTE(false, false);

    private final boolean upperCase;
    private final boolean stripAccents;

    NormalizationRule(boolean upperCase, boolean stripAccents) {
        this.upperCase = upperCase;
        this.stripAccents = stripAccents;
    }

    public static NormalizationRule forType(PicklistType type) {
        return switch (type) {
            case BRAND -> BRAND;
            case CATEGORY -> CATEGORY;
            case STYLE -> STYLE;
            case ATTRIBUTE -> ATTRIBUTE;
        };
    }

    public String fold(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        String cased = upperCase ? trimmed.toUpperCase(Locale.ROOT) : trimmed.toLowerCase(Locale.ROOT);
        return stripAccents ? StringSimilarity.stripAccents(cased) : cased;
    }

    public boolean stripsAccents() {
        return stripAccents;
    }
}
