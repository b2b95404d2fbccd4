package com.purchasingpower.cora.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RankingProperties {

    /** Number of candidates requested from the hybrid store. */
    @Min(1)
    private int candidateCount = 20;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double damping = 0.85;

    @Min(1)
    private int maxIterations = 50;

    private double tolerance = 1e-6;

    private double retrievalWeight = 0.6;

    private double linkWeight = 0.4;

    /** Minimum combined score for chunks reached only through graph expansion. */
    private double inclusionThreshold = 0.25;
}
