package com.catalog.picklist.service;

/**
 * Durable write or read of a vocabulary failed. The in-memory snapshot is left as it was.
 */
public class PicklistPersistenceException extends RuntimeException {

    public PicklistPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
