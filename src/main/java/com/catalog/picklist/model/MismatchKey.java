package com.catalog.picklist.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Dedup key of a mismatch record: type, normalized value and source.
 */
public record MismatchKey(PicklistType type, String normalizedValue, String source) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);

    public static MismatchKey of(PicklistType type, String attemptedValue, String source) {
        return new MismatchKey(type, normalizeValue(attemptedValue), source);
    }

    /**
     * Lowercases, trims, collapses whitespace and strips everything outside word, space and hyphen.
     */
    public static String normalizeValue(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.toLowerCase(Locale.ROOT).trim();
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return DISALLOWED.matcher(normalized).replaceAll("");
    }
}
