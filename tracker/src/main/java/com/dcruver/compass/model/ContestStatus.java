package com.dcruver.compass.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The team's result on one contest problem.
 */
public enum ContestStatus {
    ACCEPTED("ac"),
    ATTEMPTED("attempted"),
    UNSUBMITTED("unsubmitted");

    private final String wireValue;

    ContestStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public static Optional<ContestStatus> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String candidate = text.trim().toLowerCase();
        for (ContestStatus status : values()) {
            if (status.wireValue.equals(candidate) || status.name().toLowerCase().equals(candidate)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static ContestStatus fromJson(String text) {
        return parse(text).orElse(UNSUBMITTED);
    }
}
