package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A single normalized requirement.
 *
 * @param id   Identifier, unique within its {@link RequirementSet} (e.g. 1, REQ-3, PROJ-42)
 * @param text Requirement statement
 * @param type Functional or non-functional
 */
public record Requirement(
        String id,
        String text,
        Type type
) {

    public enum Type {
        FUNCTIONAL("functional"),
        NON_FUNCTIONAL("non-functional");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
