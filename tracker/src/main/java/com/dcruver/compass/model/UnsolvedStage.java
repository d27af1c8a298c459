package com.dcruver.compass.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * How far the team got on a problem it has not solved yet.
 *
 * Each stage also recognizes the label older data files used for it,
 * so records written by earlier versions migrate onto the enum.
 */
public enum UnsolvedStage {
    UNSEEN("unseen", "未看题"),
    SEEN_NO_IDEA("seen_no_idea", "已看题无思路"),
    KNOWS_APPROACH_NOT_IMPLEMENTED("knows_approach_not_implemented", "知道做法未实现");

    private final String wireValue;
    private final String legacyLabel;

    UnsolvedStage(String wireValue, String legacyLabel) {
        this.wireValue = wireValue;
        this.legacyLabel = legacyLabel;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Parse a stored stage value, accepting both the current wire value and the legacy label.
     */
    public static Optional<UnsolvedStage> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String candidate = text.trim();
        return Arrays.stream(values())
            .filter(stage -> stage.wireValue.equals(candidate) || stage.legacyLabel.equals(candidate))
            .findFirst();
    }

    @JsonCreator
    static UnsolvedStage fromJson(String text) {
        return parse(text).orElse(null);
    }
}
