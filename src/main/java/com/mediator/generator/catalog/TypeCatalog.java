package com.mediator.generator.catalog;

import java.util.List;

import com.mediator.generator.catalog.model.TypeDescriptor;

/**
 * A consistent snapshot of declared types. The generator scans
 * {@link #getDeclaredTypes()} in order and resolves everything else through
 * {@link #findType(String)}.
 */
public interface TypeCatalog extends TypeLookup {

    /**
     * The declarations to scan for handlers, in a stable order.
     */
    List<TypeDescriptor> getDeclaredTypes();
}
