package com.mediator.generator.codegen.model;

import java.util.List;
import java.util.Optional;

import com.mediator.generator.codegen.diagnostics.Diagnostic;
import com.mediator.generator.codegen.model.core.context.GenerationStats;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one generation run: the unit (absent when no handler was accepted),
 * the diagnostics in report order and run statistics.
 */
@Value
@Builder
public class GenerationResult {

    GeneratedUnit unit;

    @NonNull
    @Singular
    List<Diagnostic> diagnostics;

    @NonNull
    @Builder.Default
    GenerationStats stats = GenerationStats.builder().build();

    @NonNull
    @Singular
    List<HandlerRecord> handlers;

    public Optional<GeneratedUnit> getUnit() {
        return Optional.ofNullable(unit);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
