package com.prodyna.pac.backend.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Audience level of a talk. Serialized in lower case.
 */
public enum TalkLevel {

    BEGINNER("beginner"),
    ADVANCED("advanced"),
    EXPERT("expert");

    private final String value;

    TalkLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Look up a level by its serialized value, ignoring case.
     *
     * @param value Serialized level, may be null
     * @return The matching level, or empty if the value is not a known level
     */
    public static Optional<TalkLevel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(level -> level.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    /**
     * Comma separated list of all serialized values, for error messages.
     */
    public static String allowedValues() {
        return Arrays.stream(values()).map(TalkLevel::getValue).collect(Collectors.joining(", "));
    }
}
