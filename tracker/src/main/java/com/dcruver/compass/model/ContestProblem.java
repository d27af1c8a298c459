package com.dcruver.compass.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

/**
 * One lettered problem inside a contest record.
 */
@Data
@Builder(toBuilder = true)
@With
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"letter", "pass_count", "attempt_count", "my_status"})
public class ContestProblem {
    private String letter;

    @JsonProperty("pass_count")
    private int passCount;

    @JsonProperty("attempt_count")
    private int attemptCount;

    @JsonProperty("my_status")
    @Builder.Default
    private ContestStatus status = ContestStatus.UNSUBMITTED;

    public static ContestProblem blank(String letter) {
        return ContestProblem.builder().letter(letter).build();
    }
}
