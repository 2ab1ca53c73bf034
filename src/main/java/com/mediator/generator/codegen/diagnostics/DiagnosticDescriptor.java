package com.mediator.generator.codegen.diagnostics;

import java.util.List;

import com.mediator.generator.catalog.model.SourceLocation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Static description of a diagnostic: stable id, title and a
 * {@link String#format(String, Object...)} message template.
 */
@Value
@Builder
public class DiagnosticDescriptor {

    @NonNull
    String id;

    @NonNull
    String title;

    @NonNull
    String messageFormat;

    @NonNull
    String category;

    @NonNull
    DiagnosticSeverity defaultSeverity;

    public Diagnostic create(SourceLocation location, Object... arguments) {
        return new Diagnostic(this, defaultSeverity, String.format(messageFormat, arguments), location,
                List.of(arguments));
    }
}
