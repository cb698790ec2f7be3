package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Intent of a scenario, derived from its wording.
 */
public enum TestType {
    FUNCTIONAL,
    SECURITY,
    PERFORMANCE,
    USABILITY,
    INTEGRATION;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
