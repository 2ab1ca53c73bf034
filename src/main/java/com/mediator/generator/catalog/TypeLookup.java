package com.mediator.generator.catalog;

import java.util.Optional;

import com.mediator.generator.catalog.model.TypeDescriptor;

/**
 * Resolves a qualified type name to its descriptor. Used for supertypes and for the
 * target contract, which may live outside the scanned declarations.
 */
@FunctionalInterface
public interface TypeLookup {

    Optional<TypeDescriptor> findType(String qualifiedName);

    static TypeLookup empty() {
        return name -> Optional.empty();
    }
}
