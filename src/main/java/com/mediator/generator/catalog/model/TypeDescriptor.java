package com.mediator.generator.catalog.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A declared type as supplied by a type catalog. Read-only to the generator.
 */
@Value
@Builder(toBuilder = true)
public class TypeDescriptor {

    /** Canonical name, nested types joined with '.'. */
    @NonNull
    String qualifiedName;

    @NonNull
    @Builder.Default
    DeclarationKind kind = DeclarationKind.CLASS;

    /** Effective accessibility from outside the declaring package. */
    @NonNull
    @Builder.Default
    Accessibility accessibility = Accessibility.PUBLIC;

    boolean isAbstract;

    /** A static type that can never be instantiated. Java static nested classes are not static in this sense. */
    boolean isStatic;

    /** Inner (non-static member) class: every constructor needs an enclosing instance. */
    boolean requiresEnclosingInstance;

    @Singular
    List<String> typeParameters;

    /** Arguments of a constructed generic type; empty for declarations. */
    @Singular
    List<TypeReference> typeArguments;

    /** The explicit extends/implements clauses, in declaration order. */
    @Singular
    List<BaseTypeClause> baseTypes;

    @Singular
    List<ConstructorDescriptor> constructors;

    @NonNull
    @Builder.Default
    SourceLocation location = SourceLocation.NONE;

    public String getSimpleName() {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    public int getGenericArity() {
        return typeParameters.size();
    }

    /**
     * A generic declaration with no type arguments supplied.
     */
    public boolean isUnboundGenericDefinition() {
        return !typeParameters.isEmpty() && typeArguments.isEmpty();
    }

    public boolean hasDeclaredBaseTypes() {
        return !baseTypes.isEmpty();
    }
}
