package com.dcruver.compass.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.With;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tracked competitive-programming problem in its current schema.
 *
 * {@code hasSolution} is derived from the solution side-file and never persisted.
 * Keys this version does not know about are carried in {@code extras} so a
 * round-trip through the store never drops them.
 */
@Data
@Builder(toBuilder = true)
@With
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"id", "title", "link", "source", "tags", "assignee", "solved", "unsolved_stage",
    "unsolved_custom_label", "pass_count", "notes", "created_at", "updated_at", "has_solution"})
public class Problem {
    public static final String HAS_SOLUTION = "has_solution";

    private String id;
    private String title;
    private String link;
    private String source;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String assignee;
    private boolean solved;
    private UnsolvedStage unsolvedStage;
    private String unsolvedCustomLabel;
    private Integer passCount;
    private String notes;
    private Instant createdAt;
    private Instant updatedAt;

    private boolean hasSolution;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Map<String, Object> extras = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }
}
