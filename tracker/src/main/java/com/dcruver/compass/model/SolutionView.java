package com.dcruver.compass.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A problem's solution write-up as shown to the operator.
 */
@Value
@Builder
public class SolutionView {
    String id;
    String markdown;
    boolean hasSolution;
    Instant updatedAt;
}
