package com.metaperception.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.model.PerceptionState;

/**
 * Result of {@link MetaPerceptionOrchestrator#step}: the state to thread into the next
 * cycle and the output to hand to the caller.
 */
public record PerceptionStepResult(
    @JsonProperty("newState") PerceptionState newState,
    @JsonProperty("output")   MetaPerceptionOutput output
) {}
