package com.catalog.picklist.matching;

import com.catalog.picklist.model.PicklistType;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Registered equivalences applied before scoring. Keys are lower-cased surface forms; values are
 * the canonical search term. Category targets may be a category id ("range") or a canonical
 * category name ("wall sconces").
 */
public final class PicklistAliases {

    static final Map<String, String> ATTRIBUTE_ALIASES = Map.ofEntries(
            entry("drain position", "drain placement"),
            entry("drain location", "drain placement"),
            entry("overall width", "width"),
            entry("overall depth", "depth"),
            entry("nominal width", "width"),
            entry("nominal depth", "depth"),
            entry("nominal length", "length"),
            entry("installation type", "mount type"),
            entry("mounting type", "mount type"),
            entry("number of basins", "number of bowls"),
            entry("basin count", "number of bowls"),
            entry("sink material", "material"),
            entry("faucet material", "material"),
            entry("construction material", "material"),
            entry("minimum cabinet size", "cabinet size"),
            entry("cabinet width", "cabinet size")
    );

    static final Map<String, String> CATEGORY_ALIASES = Map.ofEntries(
            // AI surface forms to category ids
            entry("gas range", "range"),
            entry("gas ranges", "range"),
            entry("electric range", "range"),
            entry("electric ranges", "range"),
            entry("dual fuel range", "range"),
            entry("dual fuel ranges", "range"),
            entry("induction range", "range"),
            entry("freestanding range", "range"),
            entry("slide in range", "range"),
            entry("french door refrigerator", "refrigerator"),
            entry("side by side refrigerator", "refrigerator"),
            entry("bottom freezer refrigerator", "refrigerator"),
            entry("top freezer refrigerator", "refrigerator"),
            entry("wall oven", "oven"),
            entry("double wall oven", "oven"),
            entry("single wall oven", "oven"),
            entry("gas cooktop", "cooktop"),
            entry("electric cooktop", "cooktop"),
            entry("induction cooktop", "cooktop"),
            entry("over the range microwave", "microwave"),
            entry("countertop microwave", "microwave"),
            entry("built in microwave", "microwave"),
            entry("upright freezer", "freezer"),
            entry("chest freezer", "freezer"),
            entry("front load washer", "washer"),
            entry("top load washer", "washer"),
            entry("gas dryer", "dryer"),
            entry("electric dryer", "dryer"),
            entry("pedestal sink", "bathroom_sinks"),
            entry("vessel sink", "bathroom_sinks"),
            entry("undermount sink", "bathroom_sinks"),
            entry("drop in sink", "bathroom_sinks"),
            entry("freestanding bathtub", "bathtubs"),
            entry("alcove bathtub", "bathtubs"),
            entry("soaking tub", "bathtubs"),
            entry("whirlpool tub", "bathtubs"),
            entry("pull down faucet", "kitchen_faucets"),
            entry("pull out faucet", "kitchen_faucets"),
            entry("touchless faucet", "kitchen_faucets"),
            entry("single handle faucet", "bathroom_faucets"),
            entry("widespread faucet", "bathroom_faucets"),
            entry("one piece toilet", "toilets"),
            entry("two piece toilet", "toilets"),
            entry("comfort height toilet", "toilets"),
            entry("bidet toilet", "toilets"),
            // display variants to canonical names
            entry("sconces", "wall sconces"),
            entry("wall lights", "wall sconces"),
            entry("ceiling fixtures", "ceiling lights"),
            entry("overhead lighting", "ceiling lights"),
            entry("hanging pendants", "pendant lights"),
            entry("can lights", "recessed lighting"),
            entry("downlights", "recessed lighting"),
            entry("stoves", "ranges"),
            entry("fridges", "refrigerators"),
            entry("dish washers", "dishwashers"),
            entry("stovetops", "cooktops"),
            entry("vent hoods", "range hoods"),
            entry("exhaust hoods", "range hoods"),
            entry("wine chillers", "wine coolers"),
            entry("commodes", "toilets"),
            entry("water closets", "toilets"),
            entry("showerheads", "shower heads"),
            entry("bbq grills", "grills"),
            entry("barbecue grills", "grills"),
            entry("counter tops", "countertops")
    );

    private PicklistAliases() {
    }

    /**
     * @param foldedCandidate candidate already folded by the type's {@link NormalizationRule}
     */
    public static Optional<String> lookup(PicklistType type, String foldedCandidate) {
        return switch (type) {
            case ATTRIBUTE -> Optional.ofNullable(ATTRIBUTE_ALIASES.get(foldedCandidate));
            case CATEGORY -> Optional.ofNullable(CATEGORY_ALIASES.get(foldedCandidate));
            default -> Optional.empty();
        };
    }
}
