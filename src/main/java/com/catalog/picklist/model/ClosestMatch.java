package com.catalog.picklist.model;

/**
 * One vocabulary candidate kept alongside a mismatch, most similar first.
 */
public record ClosestMatch(String value, String id, double similarity) {
}
