package com.catalog.picklist.dto;

import com.catalog.picklist.model.ResolutionAction;

/**
 * Validated resolution details applied to one or more mismatch records.
 */
public record MismatchResolution(
        ResolutionAction action,
        String resolvedValue,
        String resolvedTo,
        String notes,
        String resolvedBy
) {

    public static final String DEFAULT_RESOLVED_BY = "api";

    /**
     * @throws IllegalArgumentException when the action is missing or unknown
     */
    public static MismatchResolution of(String action,
                                        String resolvedValue,
                                        String resolvedTo,
                                        String notes,
                                        String resolvedBy) {
        return new MismatchResolution(
                ResolutionAction.fromValue(action),
                resolvedValue,
                resolvedTo,
                notes,
                resolvedBy == null || resolvedBy.isBlank() ? DEFAULT_RESOLVED_BY : resolvedBy);
    }
}
