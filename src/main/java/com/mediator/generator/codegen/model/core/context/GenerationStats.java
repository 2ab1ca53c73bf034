package com.mediator.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationStats {

    int declaredTypes;
    int candidates;
    int eligibleTypes;
    int contractMatches;
    int handlersRegistered;
}
