package com.mediator.generator.codegen.model;

import com.mediator.generator.catalog.model.TypeReference;

import lombok.NonNull;
import lombok.Value;

/**
 * The (input, output) pair two handlers must not share.
 */
@Value
public class HandlerSignature {

    @NonNull
    String inputType;

    @NonNull
    String outputType;

    public static HandlerSignature of(TypeReference inputType, TypeReference outputType) {
        return new HandlerSignature(inputType.toDisplayString(), outputType.toDisplayString());
    }

    @Override
    public String toString() {
        return inputType + "|" + outputType;
    }
}
