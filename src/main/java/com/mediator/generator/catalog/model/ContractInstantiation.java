package com.mediator.generator.catalog.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * A type's implementation of the target contract: the contract's qualified name,
 * the type arguments after substitution, and the direct base-list clause through
 * which it was reached (null when unknown).
 */
@Value
public class ContractInstantiation {

    @NonNull
    String origin;

    @NonNull
    List<TypeReference> typeArguments;

    BaseTypeClause via;

    public int getArity() {
        return typeArguments.size();
    }

    public String toDisplayString() {
        return TypeReference.declared(origin, typeArguments).toDisplayString();
    }
}
