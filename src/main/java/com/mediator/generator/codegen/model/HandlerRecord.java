package com.mediator.generator.codegen.model;

import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.catalog.model.TypeReference;

import lombok.NonNull;
import lombok.Value;

/**
 * An accepted handler: one registration in the generated code.
 */
@Value
public class HandlerRecord {

    @NonNull
    TypeDescriptor handlerType;

    @NonNull
    TypeReference inputType;

    @NonNull
    TypeReference outputType;

    public String getHandlerName() {
        return handlerType.getQualifiedName();
    }

    public HandlerSignature getSignature() {
        return HandlerSignature.of(inputType, outputType);
    }
}
