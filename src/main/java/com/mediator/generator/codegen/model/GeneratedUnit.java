package com.mediator.generator.codegen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * The emitted source file.
 */
@Value
public class GeneratedUnit {

    /** Stable logical name: the qualified name of the generated class. */
    @NonNull
    String name;

    /** Path relative to a source root, e.g. {@code com/mediator/generated/MediatorHandlerRegistrations.java}. */
    @NonNull
    String relativePath;

    @NonNull
    String content;
}
