package com.catalog.picklist.service;

import java.util.List;

/**
 * Request payload failed validation; carries every error found, not just the first.
 */
public class PicklistValidationException extends RuntimeException {

    private final List<String> errors;

    public PicklistValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
