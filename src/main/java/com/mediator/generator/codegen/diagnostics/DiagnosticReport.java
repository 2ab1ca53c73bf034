package com.mediator.generator.codegen.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics accumulated during one generation run, in the order they were reported.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
public class DiagnosticReport {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public long count(DiagnosticDescriptor descriptor) {
        return diagnostics.stream().filter(d -> d.getDescriptor().equals(descriptor)).count();
    }
}
