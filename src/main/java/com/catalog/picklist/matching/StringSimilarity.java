package com.catalog.picklist.matching;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Edit-distance based similarity used by the picklist matcher.
 */
public final class StringSimilarity {

    static final double CONTAINMENT_SIMILARITY = 0.9;

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{InCombiningDiacriticalMarks}+");

    private StringSimilarity() {
    }

    /**
     * Case-insensitive similarity in [0, 1]: 1.0 when equal, 0.9 when one string contains the
     * other, otherwise {@code 1 - levenshtein / maxLength}.
     */
    public static double similarity(String first, String second) {
        String s1 = first == null ? "" : first.toLowerCase(Locale.ROOT).trim();
        String s2 = second == null ? "" : second.toLowerCase(Locale.ROOT).trim();

        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.contains(s2) || s2.contains(s1)) {
            return CONTAINMENT_SIMILARITY;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - ((double) levenshtein(s1, s2) / maxLength);
    }

    public static int levenshtein(String s1, String s2) {
        return LEVENSHTEIN.apply(s1, s2);
    }

    /**
     * NFD-decomposes and drops combining diacritical marks ("Café" becomes "Cafe").
     */
    public static String stripAccents(String value) {
        if (value == null) {
            return null;
        }
        return COMBINING_MARKS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
    }
}
