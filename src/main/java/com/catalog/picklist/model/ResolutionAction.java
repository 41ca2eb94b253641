package com.catalog.picklist.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum ResolutionAction {

    ADDED_TO_PICKLIST("added_to_picklist"),
    MAPPED_TO_EXISTING("mapped_to_existing"),
    IGNORED("ignored"),
    VALUE_CORRECTED("value_corrected"),
    FALSE_POSITIVE("false_positive");

    private final String value;

    ResolutionAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResolutionAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resolution action is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResolutionAction action : values()) {
            if (action.value.equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("action must be one of: " + Arrays.stream(values())
                .map(ResolutionAction::getValue)
                .collect(Collectors.joining(", ")));
    }
}
