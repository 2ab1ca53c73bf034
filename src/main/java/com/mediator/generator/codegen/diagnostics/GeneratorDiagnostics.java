package com.mediator.generator.codegen.diagnostics;

/**
 * Every diagnostic the generator can report.
 */
public final class GeneratorDiagnostics {

    private static final String CATEGORY = "Mediator.Generator";

    public static final DiagnosticDescriptor MISSING_TARGET_CONTRACT = DiagnosticDescriptor.builder()
            .id("missing-target-contract")
            .title("Handler contract not found")
            .messageFormat("The %s<,> interface could not be found. Ensure the library declaring it is referenced.")
            .category(CATEGORY)
            .defaultSeverity(DiagnosticSeverity.WARNING)
            .build();

    public static final DiagnosticDescriptor ARITY_MISMATCH = DiagnosticDescriptor.builder()
            .id("arity-mismatch")
            .title("Invalid handler contract implementation")
            .messageFormat("Handler '%s' implements %s with %d type arguments instead of 2")
            .category(CATEGORY)
            .defaultSeverity(DiagnosticSeverity.WARNING)
            .build();

    public static final DiagnosticDescriptor DUPLICATE_HANDLER = DiagnosticDescriptor.builder()
            .id("duplicate-handler")
            .title("Duplicate request handler")
            .messageFormat("Multiple handlers found for request type '%s' returning '%s'. Handler: '%s'")
            .category(CATEGORY)
            .defaultSeverity(DiagnosticSeverity.WARNING)
            .build();

    private GeneratorDiagnostics() {
        // Constants holder
    }
}
