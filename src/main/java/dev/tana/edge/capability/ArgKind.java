package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Argument schema entry checked before a capability runs.
 */
public enum ArgKind {
    NUMBER("a number") {
        @Override
        boolean accepts(JsonNode value) {
            return value != null && value.isNumber();
        }
    },
    STRING("a string") {
        @Override
        boolean accepts(JsonNode value) {
            return value != null && value.isTextual();
        }
    },
    OPTIONAL_STRING("a string or null") {
        @Override
        boolean accepts(JsonNode value) {
            return value == null || value.isNull() || value.isMissingNode() || value.isTextual();
        }
    },
    STRUCTURED("any JSON value") {
        @Override
        boolean accepts(JsonNode value) {
            return true;
        }
    };

    private final String description;

    ArgKind(String description) {
        this.description = description;
    }

    abstract boolean accepts(JsonNode value);

    public String description() {
        return description;
    }
}
