package com.catalog.picklist.service;

import com.catalog.picklist.model.PicklistItem;

/**
 * Thrown by add when an entry with the same id or (case-insensitively) the same name exists.
 */
public class PicklistConflictException extends RuntimeException {

    private final PicklistItem existing;

    public PicklistConflictException(String message, PicklistItem existing) {
        super(message);
        this.existing = existing;
    }

    public PicklistItem getExisting() {
        return existing;
    }
}
