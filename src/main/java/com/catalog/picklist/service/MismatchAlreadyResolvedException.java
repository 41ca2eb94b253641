package com.catalog.picklist.service;

/**
 * Resolution is terminal; a resolved record cannot be resolved again.
 */
public class MismatchAlreadyResolvedException extends RuntimeException {

    public MismatchAlreadyResolvedException(String message) {
        super(message);
    }
}
