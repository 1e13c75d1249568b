package com.example.roster.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Party grouping of a committee seat. Rosters list the majority side first and the minority side second.
 */
public enum Group {
    MAJORITY("Majority"),
    MINORITY("Minority");

    private final String label;

    Group(String label) {
        this.label = label;
    }

    /**
     * @return label as printed in the roster and used in serialized output
     */
    @JsonValue
    public String label() {
        return label;
    }
}
