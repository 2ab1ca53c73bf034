package com.mediator.generator.codegen.diagnostics;

import java.util.List;

import com.mediator.generator.catalog.model.SourceLocation;

import lombok.NonNull;
import lombok.Value;

/**
 * A reported finding. Immutable once created.
 */
@Value
public class Diagnostic {

    @NonNull
    DiagnosticDescriptor descriptor;

    @NonNull
    DiagnosticSeverity severity;

    @NonNull
    String message;

    @NonNull
    SourceLocation location;

    @NonNull
    List<Object> arguments;

    public String getId() {
        return descriptor.getId();
    }

    /**
     * {@code location: severity [id] message}, the form hosts print.
     */
    public String format() {
        return location.describe() + ": " + severity.name().toLowerCase() + " [" + getId() + "] " + message;
    }
}
