package com.mediator.generator.codegen.diagnostics;

public enum DiagnosticSeverity {
    INFO,
    WARNING,
    ERROR
}
