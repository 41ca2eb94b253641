package com.catalog.picklist.service;

public class MismatchNotFoundException extends RuntimeException {

    public MismatchNotFoundException(String message) {
        super(message);
    }
}
