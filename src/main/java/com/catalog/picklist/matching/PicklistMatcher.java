package com.catalog.picklist.matching;

import com.catalog.picklist.model.ClosestMatch;
import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a free-text candidate against one vocabulary snapshot.
 *
 * Steps: blank check, attribute guards, normalization, alias substitution, exact match,
 * similarity scoring against the type threshold, containment fallback, unmatched.
 * The matcher is stateless apart from its thresholds and never records anything itself.
 */
public class PicklistMatcher {

    private static final Logger logger = LoggerFactory.getLogger(PicklistMatcher.class);

    static final double THRESHOLD_TOLERANCE = 1e-9;
    static final int MAX_SUGGESTIONS = 3;

    private final Map<PicklistType, Double> thresholds;

    public PicklistMatcher() {
        this(Map.of());
    }

    /**
     * @param thresholdOverrides per-type fuzzy thresholds; types missing here use their defaults
     */
    public PicklistMatcher(Map<PicklistType, Double> thresholdOverrides) {
        this.thresholds = new EnumMap<>(PicklistType.class);
        for (PicklistType type : PicklistType.values()) {
            Double override = thresholdOverrides.get(type);
            thresholds.put(type, override != null ? override : type.getDefaultThreshold());
        }
    }

    public double thresholdFor(PicklistType type) {
        return thresholds.get(type);
    }

    public MatchResult match(PicklistType type, String candidate, List<? extends PicklistItem> vocabulary) {
        if (candidate == null || candidate.isBlank()) {
            return MatchResult.empty(type, candidate);
        }
        NormalizationRule rule = NormalizationRule.forType(type);

        if (type == PicklistType.ATTRIBUTE) {
            if (AttributeClassifier.isPrimaryAttribute(candidate)) {
                logger.debug("'{}' is a primary attribute; skipping vocabulary lookup", candidate);
                return MatchResult.primaryAttribute(candidate, rule.fold(candidate));
            }
            if (AttributeClassifier.isAttributeValue(candidate)) {
                logger.debug("'{}' looks like an attribute value, not a name", candidate);
                return MatchResult.attributeValue(candidate, rule.fold(candidate));
            }
        }

        String folded = rule.fold(candidate);
        Optional<String> alias = PicklistAliases.lookup(type, folded);
        String searchTerm = alias.orElse(folded);
        boolean aliasApplied = alias.isPresent();

        if (vocabulary == null || vocabulary.isEmpty()) {
            return unmatched(type, candidate, searchTerm, aliasApplied, List.of());
        }
        // A blank name folds to "" and would contain-match every candidate.
        List<? extends PicklistItem> named = vocabulary.stream()
                .filter(item -> item != null && !PicklistItem.isBlank(item.name()))
                .toList();
        if (named.isEmpty()) {
            return unmatched(type, candidate, searchTerm, aliasApplied, List.of());
        }

        for (PicklistItem item : named) {
            boolean nameMatches = rule.fold(item.name()).equals(searchTerm);
            boolean idMatches = aliasApplied && item.id() != null && item.id().equalsIgnoreCase(searchTerm);
            if (nameMatches || idMatches) {
                return new MatchResult(type, candidate, true, MatchKind.EXACT, item, 1.0,
                        List.of(), searchTerm, aliasApplied, List.of());
            }
        }

        // Stream.sorted is stable: equal scores keep collection order.
        List<Scored> scored = named.stream()
                .map(item -> new Scored(item, StringSimilarity.similarity(searchTerm, rule.fold(item.name()))))
                .sorted(Comparator.comparingDouble(Scored::similarity).reversed())
                .toList();

        Scored best = scored.get(0);
        if (best.similarity() >= thresholdFor(type) - THRESHOLD_TOLERANCE) {
            return new MatchResult(type, candidate, true, MatchKind.FUZZY, best.item(), best.similarity(),
                    items(scored.subList(1, Math.min(scored.size(), 1 + MAX_SUGGESTIONS))),
                    searchTerm, aliasApplied, List.of());
        }

        Optional<? extends PicklistItem> partial = findContaining(named, rule, searchTerm);
        if (partial.isPresent()) {
            PicklistItem hit = partial.get();
            List<PicklistItem> suggestions = scored.stream()
                    .map(Scored::item)
                    .filter(item -> item != hit)
                    .limit(MAX_SUGGESTIONS)
                    .toList();
            return new MatchResult(type, candidate, true, MatchKind.PARTIAL, hit, type.getPartialConfidence(),
                    suggestions, searchTerm, aliasApplied, List.of());
        }

        return unmatched(type, candidate, searchTerm, aliasApplied, scored);
    }

    private static Optional<? extends PicklistItem> findContaining(List<? extends PicklistItem> vocabulary,
                                                                   NormalizationRule rule,
                                                                   String searchTerm) {
        return vocabulary.stream()
                .filter(item -> {
                    String name = rule.fold(item.name());
                    return name.contains(searchTerm) || searchTerm.contains(name);
                })
                .findFirst();
    }

    private static MatchResult unmatched(PicklistType type,
                                         String candidate,
                                         String searchTerm,
                                         boolean aliasApplied,
                                         List<Scored> scored) {
        List<Scored> top = scored.subList(0, Math.min(scored.size(), MAX_SUGGESTIONS));
        double bestSimilarity = top.isEmpty() ? 0.0 : top.get(0).similarity();
        List<ClosestMatch> closest = top.stream()
                .map(s -> new ClosestMatch(s.item().name(), s.item().id(), s.similarity()))
                .toList();
        return new MatchResult(type, candidate, false, MatchKind.UNMATCHED, null, bestSimilarity,
                items(top), searchTerm, aliasApplied, closest);
    }

    private static List<PicklistItem> items(List<Scored> scored) {
        return scored.stream().<PicklistItem>map(Scored::item).toList();
    }

    private record Scored(PicklistItem item, double similarity) {
    }
}
