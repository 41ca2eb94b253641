package com.catalog.picklist.dto;

import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
public class BulkResolveRequest {

    private List<UUID> ids;
    private String action;
    private String resolvedValue;
    private String resolvedTo;
    private String notes;
    private String resolvedBy;

    public MismatchResolution toResolution() {
        return MismatchResolution.of(action, resolvedValue, resolvedTo, notes, resolvedBy);
    }
}
