package com.metaperception.core.uncertainty;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.config.UncertaintyWeights;

/**
 * Normalized uncertainty components, the weights applied to them and their weighted sum.
 */
public record UncertaintyBreakdown(
    @JsonProperty("entropyComponent")     double entropyComponent,
    @JsonProperty("noiseComponent")       double noiseComponent,
    @JsonProperty("reflexivityComponent") double reflexivityComponent,
    @JsonProperty("regimeComponent")      double regimeComponent,
    @JsonProperty("weights")              UncertaintyWeights weights,
    @JsonProperty("total")                double total
) {}
