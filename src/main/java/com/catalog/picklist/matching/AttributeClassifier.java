package com.catalog.picklist.matching;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-classification guards applied to attribute candidates before any vocabulary lookup.
 *
 * Primary attributes (brand, width, model number, ...) have dedicated fields on every product and
 * are never picklist members. Candidates that are really attribute values ("chrome", "24 inches")
 * are recognised so callers do not request them as missing attribute names.
 */
public final class AttributeClassifier {

    static final Set<String> PRIMARY_ATTRIBUTE_NAMES = Set.of(
            "brand", "brand (verified)",
            "category", "category / subcategory", "category / subcategory (verified)",
            "product family", "product family (verified)",
            "product style", "product style (verified)", "product style (verified) (category specific)",
            "depth", "length", "depth / length", "depth / length (verified)",
            "width", "width (verified)",
            "height", "height (verified)",
            "weight", "weight (verified)",
            "msrp", "msrp (verified)",
            "market value",
            "description",
            "product title", "product title (verified)",
            "details",
            "features", "features list",
            "upc", "gtin", "upc / gtin", "upc / gtin (verified)",
            "model number", "model number (verified)",
            "model number alias", "model number alias (symbols removed)",
            "model parent",
            "model variant", "model variant number",
            "total model variants", "total model variants (list all variant models)"
    );

    static final Set<String> PRIMARY_ATTRIBUTE_FIELD_KEYS = Set.of(
            "brand_verified", "brand",
            "category_subcategory_verified", "category_subcategory", "category",
            "product_family_verified", "product_family",
            "product_style_verified", "product_style", "style",
            "depth_length_verified", "depth_length", "depth", "length",
            "width_verified", "width",
            "height_verified", "height",
            "weight_verified", "weight",
            "msrp_verified", "msrp",
            "market_value",
            "description",
            "product_title_verified", "product_title", "title",
            "details",
            "features_list", "features",
            "upc_gtin_verified", "upc_gtin", "upc", "gtin",
            "model_number_verified", "model_number",
            "model_number_alias",
            "model_parent",
            "model_variant_number", "model_variant",
            "total_model_variants"
    );

    private static final Set<String> CORE_TERMS = Set.of(
            "width", "height", "depth", "length", "weight", "msrp", "brand", "category",
            "description", "title", "model", "upc", "gtin", "features");

    static final Set<String> KNOWN_ATTRIBUTE_VALUES = Set.of(
            // configuration
            "single bowl", "double bowl", "triple bowl", "single basin", "double basin",
            // mount type
            "undermount", "drop-in", "undermount/drop-in", "farmhouse", "apron", "vessel", "wall mount",
            // material
            "stainless steel", "fireclay", "granite composite", "cast iron", "porcelain", "copper",
            // finish
            "brushed nickel", "chrome", "matte black", "polished chrome", "oil rubbed bronze",
            // boolean-like
            "yes", "no", "true", "false", "included", "not included",
            // appliance styles
            "french door", "side-by-side", "top freezer", "bottom freezer",
            "front load", "top load", "gas", "electric", "induction"
    );

    private static final Pattern DIMENSION_VALUE = Pattern.compile(
            "^\\d+(\\.\\d+)?\\s*(inches?|in|ft|cm|mm|lbs?|oz|gallons?|gal|cu\\.?\\s*ft)?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BOOLEAN_VALUE = Pattern.compile(
            "^(yes|no|true|false|included|not included|n/a)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern NON_ALPHANUMERIC_RUN = Pattern.compile("[^a-z0-9]+");

    private AttributeClassifier() {
    }

    public static boolean isPrimaryAttribute(String candidate) {
        if (candidate == null) {
            return false;
        }
        String normalized = candidate.toLowerCase(Locale.ROOT).trim();
        if (PRIMARY_ATTRIBUTE_NAMES.contains(normalized)) {
            return true;
        }
        String fieldKey = toFieldKey(normalized);
        return PRIMARY_ATTRIBUTE_FIELD_KEYS.contains(fieldKey)
                || CORE_TERMS.contains(normalized)
                || CORE_TERMS.contains(fieldKey);
    }

    public static boolean isAttributeValue(String candidate) {
        if (candidate == null) {
            return false;
        }
        String trimmed = candidate.trim();
        String normalized = trimmed.toLowerCase(Locale.ROOT);

        if (KNOWN_ATTRIBUTE_VALUES.contains(normalized)) {
            return true;
        }
        if (DIMENSION_VALUE.matcher(trimmed).matches() || BOOLEAN_VALUE.matcher(normalized).matches()) {
            return true;
        }
        // "undermount/drop-in" style option lists; certification names keep their slash
        if (normalized.contains("/") && !normalized.contains("certified") && !normalized.contains("compliant")) {
            return Arrays.stream(normalized.split("/"))
                    .map(String::trim)
                    .allMatch(KNOWN_ATTRIBUTE_VALUES::contains);
        }
        return false;
    }

    /**
     * "Depth / Length (Verified)" becomes "depth_length_verified".
     */
    static String toFieldKey(String normalizedName) {
        String key = NON_ALPHANUMERIC_RUN.matcher(normalizedName).replaceAll("_");
        int start = 0;
        int end = key.length();
        while (start < end && key.charAt(start) == '_') start++;
        while (end > start && key.charAt(end - 1) == '_') end--;
        return key.substring(start, end);
    }
}
