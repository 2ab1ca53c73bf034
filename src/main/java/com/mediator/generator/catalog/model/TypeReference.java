package com.mediator.generator.catalog.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A use of a type: {@code com.acme.Wrapper<java.lang.String>}, {@code T},
 * {@code com.acme.Req[]} or {@code ? extends com.acme.Base}.
 *
 * Declared names are canonical (nested types joined with '.'), so
 * {@link #toDisplayString()} is the fully-qualified form generated code can use as is.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TypeReference {

    public enum Kind {
        DECLARED,
        TYPE_VARIABLE,
        ARRAY,
        WILDCARD
    }

    @NonNull
    Kind kind;

    /** Qualified name for DECLARED, variable name for TYPE_VARIABLE, null otherwise. */
    String name;

    @NonNull
    List<TypeReference> typeArguments;

    /** Element type of an ARRAY. */
    TypeReference componentType;

    /** {@code ? extends} bound of a WILDCARD. */
    TypeReference upperBound;

    /** {@code ? super} bound of a WILDCARD. */
    TypeReference lowerBound;

    public static TypeReference declared(String qualifiedName, TypeReference... typeArguments) {
        return declared(qualifiedName, List.of(typeArguments));
    }

    public static TypeReference declared(String qualifiedName, List<TypeReference> typeArguments) {
        return new TypeReference(Kind.DECLARED, qualifiedName, List.copyOf(typeArguments), null, null, null);
    }

    public static TypeReference typeVariable(String name) {
        return new TypeReference(Kind.TYPE_VARIABLE, name, List.of(), null, null, null);
    }

    public static TypeReference array(TypeReference componentType) {
        return new TypeReference(Kind.ARRAY, null, List.of(), componentType, null, null);
    }

    public static TypeReference wildcard() {
        return new TypeReference(Kind.WILDCARD, null, List.of(), null, null, null);
    }

    public static TypeReference wildcardExtends(TypeReference bound) {
        return new TypeReference(Kind.WILDCARD, null, List.of(), null, bound, null);
    }

    public static TypeReference wildcardSuper(TypeReference bound) {
        return new TypeReference(Kind.WILDCARD, null, List.of(), null, null, bound);
    }

    public boolean isTypeVariable() {
        return kind == Kind.TYPE_VARIABLE;
    }

    /**
     * A declared reference written without type arguments. Whether that is a raw use
     * of a generic type depends on the referenced declaration.
     */
    public boolean hasTypeArguments() {
        return !typeArguments.isEmpty();
    }

    public String getSimpleName() {
        return switch (kind) {
            case DECLARED -> name.substring(name.lastIndexOf('.') + 1);
            case TYPE_VARIABLE -> name;
            case ARRAY -> componentType.getSimpleName() + "[]";
            case WILDCARD -> "?";
        };
    }

    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        appendDisplay(sb);
        return sb.toString();
    }

    private void appendDisplay(StringBuilder sb) {
        switch (kind) {
            case DECLARED -> {
                sb.append(name);
                if (!typeArguments.isEmpty()) {
                    sb.append('<');
                    for (int i = 0; i < typeArguments.size(); i++) {
                        if (i > 0) {
                            sb.append(", ");
                        }
                        typeArguments.get(i).appendDisplay(sb);
                    }
                    sb.append('>');
                }
            }
            case TYPE_VARIABLE -> sb.append(name);
            case ARRAY -> {
                componentType.appendDisplay(sb);
                sb.append("[]");
            }
            case WILDCARD -> {
                sb.append('?');
                if (upperBound != null) {
                    sb.append(" extends ");
                    upperBound.appendDisplay(sb);
                } else if (lowerBound != null) {
                    sb.append(" super ");
                    lowerBound.appendDisplay(sb);
                }
            }
        }
    }

    /**
     * Replaces type variables bound in {@code bindings}; unbound variables are kept.
     */
    public TypeReference substitute(Map<String, TypeReference> bindings) {
        if (bindings.isEmpty()) {
            return this;
        }
        return switch (kind) {
            case TYPE_VARIABLE -> bindings.getOrDefault(name, this);
            case DECLARED -> {
                if (typeArguments.isEmpty()) {
                    yield this;
                }
                List<TypeReference> substituted = new ArrayList<>(typeArguments.size());
                for (TypeReference argument : typeArguments) {
                    substituted.add(argument.substitute(bindings));
                }
                yield declared(name, substituted);
            }
            case ARRAY -> array(componentType.substitute(bindings));
            case WILDCARD -> {
                if (upperBound != null) {
                    yield wildcardExtends(upperBound.substitute(bindings));
                }
                if (lowerBound != null) {
                    yield wildcardSuper(lowerBound.substitute(bindings));
                }
                yield this;
            }
        };
    }

    /**
     * Raw form: type arguments dropped, type variables widened to {@code java.lang.Object}.
     */
    public TypeReference erasure() {
        return switch (kind) {
            case DECLARED -> typeArguments.isEmpty() ? this : declared(name);
            case ARRAY -> array(componentType.erasure());
            case TYPE_VARIABLE, WILDCARD -> declared("java.lang.Object");
        };
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
