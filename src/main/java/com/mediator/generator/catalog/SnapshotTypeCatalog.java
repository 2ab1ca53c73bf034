package com.mediator.generator.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.mediator.generator.catalog.model.TypeDescriptor;

/**
 * Immutable in-memory catalog. Declared types are resolvable by name; anything else
 * goes to the fallback lookup (typically a {@link ClasspathTypeLookup}).
 *
 * When two declarations share a qualified name the first one wins.
 */
public class SnapshotTypeCatalog implements TypeCatalog {

    private final List<TypeDescriptor> declaredTypes;
    private final Map<String, TypeDescriptor> typesByName;
    private final TypeLookup fallback;

    public SnapshotTypeCatalog(List<TypeDescriptor> declaredTypes, TypeLookup fallback) {
        this.declaredTypes = List.copyOf(declaredTypes);
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        Map<String, TypeDescriptor> byName = new LinkedHashMap<>();
        for (TypeDescriptor type : this.declaredTypes) {
            byName.putIfAbsent(type.getQualifiedName(), type);
        }
        this.typesByName = Map.copyOf(byName);
    }

    public static SnapshotTypeCatalog of(TypeDescriptor... declaredTypes) {
        return new SnapshotTypeCatalog(List.of(declaredTypes), TypeLookup.empty());
    }

    @Override
    public List<TypeDescriptor> getDeclaredTypes() {
        return declaredTypes;
    }

    @Override
    public Optional<TypeDescriptor> findType(String qualifiedName) {
        TypeDescriptor declared = typesByName.get(qualifiedName);
        return declared != null ? Optional.of(declared) : fallback.findType(qualifiedName);
    }
}
