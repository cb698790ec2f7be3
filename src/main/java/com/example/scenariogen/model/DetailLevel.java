package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * How much detail the model is asked to put in each scenario.
 */
public enum DetailLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parses a detail level, ignoring case and surrounding blanks.
     *
     * @return the level, or empty if {@code raw} is null or not low/medium/high
     */
    public static Optional<DetailLevel> parse(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> Optional.of(LOW);
            case "medium" -> Optional.of(MEDIUM);
            case "high" -> Optional.of(HIGH);
            default -> Optional.empty();
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
