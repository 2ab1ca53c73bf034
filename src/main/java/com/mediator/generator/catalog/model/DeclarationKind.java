package com.mediator.generator.catalog.model;

public enum DeclarationKind {
    CLASS,
    INTERFACE,
    ENUM,
    RECORD,
    ANNOTATION
}
