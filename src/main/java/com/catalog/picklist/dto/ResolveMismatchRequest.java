package com.catalog.picklist.dto;

import lombok.Data;

@Data
public class ResolveMismatchRequest {

    private String action;
    private String resolvedValue;
    private String resolvedTo;
    private String notes;
    private String resolvedBy;
    // When absent, every unresolved record for the type and value is resolved.
    private String source;

    public MismatchResolution toResolution() {
        return MismatchResolution.of(action, resolvedValue, resolvedTo, notes, resolvedBy);
    }
}
