package com.dcruver.compass.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
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
 * A contest result: one entry per problem letter, always exactly {@code totalProblems} of them.
 */
@Data
@Builder(toBuilder = true)
@With
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"id", "name", "total_problems", "problems", "rank_str", "summary", "created_at", "updated_at"})
public class Contest {
    public static final int MIN_PROBLEMS = 1;
    public static final int MAX_PROBLEMS = 15;

    private String id;
    private String name;
    private int totalProblems;

    @Builder.Default
    private List<ContestProblem> problems = new ArrayList<>();

    private String rankStr;
    private String summary;
    private Instant createdAt;
    private Instant updatedAt;

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

    /**
     * Number of problems the team got accepted.
     */
    @JsonIgnore
    public long getSolvedCount() {
        return problems.stream()
            .filter(problem -> problem.getStatus() == ContestStatus.ACCEPTED)
            .count();
    }
}
