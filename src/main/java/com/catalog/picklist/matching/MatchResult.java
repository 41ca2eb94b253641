package com.catalog.picklist.matching;

import com.catalog.picklist.model.ClosestMatch;
import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of matching one candidate against one vocabulary.
 *
 * @param value         the matched entry; null unless {@code matched}
 * @param similarity    score of the accepted entry, or of the best candidate when unmatched
 * @param suggestions   other close entries, best first
 * @param searchTerm    the folded (and possibly aliased) term that was compared
 * @param closestMatches top candidates kept for mismatch recording
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchResult(
        PicklistType type,
        String original,
        boolean matched,
        MatchKind kind,
        PicklistItem value,
        double similarity,
        List<PicklistItem> suggestions,
        String searchTerm,
        boolean aliasApplied,
        @JsonIgnore List<ClosestMatch> closestMatches
) {

    public static MatchResult empty(PicklistType type, String original) {
        return new MatchResult(type, original, false, MatchKind.EMPTY, null, 0.0,
                List.of(), "", false, List.of());
    }

    public static MatchResult primaryAttribute(String original, String searchTerm) {
        return new MatchResult(PicklistType.ATTRIBUTE, original, true, MatchKind.PRIMARY_ATTRIBUTE, null, 1.0,
                List.of(), searchTerm, false, List.of());
    }

    public static MatchResult attributeValue(String original, String searchTerm) {
        return new MatchResult(PicklistType.ATTRIBUTE, original, false, MatchKind.ATTRIBUTE_VALUE, null, 0.0,
                List.of(), searchTerm, false, List.of());
    }

    /**
     * Only genuine misses are worth a mismatch record; guards and blank input are not.
     */
    @JsonIgnore
    public boolean isRecordable() {
        return kind == MatchKind.UNMATCHED;
    }
}
