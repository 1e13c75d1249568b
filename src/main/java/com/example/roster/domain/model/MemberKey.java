package com.example.roster.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Identity of a legislator inside one roster document: whitespace-normalized name plus two-letter state code.
 * Two assignments with equal keys refer to the same person regardless of committee.
 */
public record MemberKey(String name, String state) implements Comparable<MemberKey> {

    public MemberKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(state, "state");
    }

    /**
     * Renders the key the way the roster prints it, e.g. {@code Pete Sessions, TX}.
     *
     * @return display label, also used as the JSON representation
     */
    @JsonValue
    public String label() {
        return name + ", " + state;
    }

    @Override
    public int compareTo(MemberKey other) {
        return label().compareTo(other.label());
    }

    @Override
    public String toString() {
        return label();
    }
}
