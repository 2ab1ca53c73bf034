package com.mediator.api;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Captures the full generic signature {@code RequestHandler<I, O>} of a
 * registration. Create it as an anonymous subclass so both type arguments survive
 * erasure:
 *
 * <pre>{@code
 * new HandlerType<com.acme.GetUser, java.util.List<java.lang.String>>() {}
 * }</pre>
 *
 * Intermediate generic subclasses are allowed as long as every argument that reaches
 * {@code HandlerType} ends up concrete, e.g. {@code new Keyed<Integer>() {}} for
 * {@code class Keyed<A> extends HandlerType<A, String>}.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
public abstract class HandlerType<I, O> {

    private final Type inputType;
    private final Type outputType;

    protected HandlerType() {
        Map<TypeVariable<?>, Type> bindings = new HashMap<>();
        Class<?> current = getClass();
        while (current.getSuperclass() != HandlerType.class) {
            Class<?> parent = current.getSuperclass();
            if (current.getGenericSuperclass() instanceof ParameterizedType parameterized) {
                TypeVariable<?>[] parameters = parent.getTypeParameters();
                Type[] arguments = parameterized.getActualTypeArguments();
                for (int i = 0; i < parameters.length; i++) {
                    bindings.put(parameters[i], resolve(arguments[i], bindings));
                }
            }
            current = parent;
        }

        if (!(current.getGenericSuperclass() instanceof ParameterizedType parameterized)) {
            throw new IllegalStateException("HandlerType must be created with explicit type arguments");
        }
        Type[] arguments = parameterized.getActualTypeArguments();
        this.inputType = concrete(resolve(arguments[0], bindings));
        this.outputType = concrete(resolve(arguments[1], bindings));
    }

    private static Type resolve(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable<?> variable) {
            return bindings.getOrDefault(variable, variable);
        }
        return type;
    }

    private Type concrete(Type type) {
        if (mentionsTypeVariable(type)) {
            throw new IllegalStateException("HandlerType argument " + type.getTypeName() + " of "
                    + getClass().getName() + " is not concrete; capture it with an anonymous subclass"
                    + " where every type argument is known");
        }
        return type;
    }

    private static boolean mentionsTypeVariable(Type type) {
        if (type instanceof TypeVariable<?>) {
            return true;
        }
        if (type instanceof ParameterizedType parameterized) {
            return Arrays.stream(parameterized.getActualTypeArguments()).anyMatch(HandlerType::mentionsTypeVariable);
        }
        if (type instanceof GenericArrayType array) {
            return mentionsTypeVariable(array.getGenericComponentType());
        }
        if (type instanceof WildcardType wildcard) {
            return Arrays.stream(wildcard.getUpperBounds()).anyMatch(HandlerType::mentionsTypeVariable)
                    || Arrays.stream(wildcard.getLowerBounds()).anyMatch(HandlerType::mentionsTypeVariable);
        }
        return false;
    }

    public Type getInputType() {
        return inputType;
    }

    public Type getOutputType() {
        return outputType;
    }

    /**
     * Two handler types are equal when they describe the same input and output.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandlerType<?, ?> other)) {
            return false;
        }
        return inputType.equals(other.inputType) && outputType.equals(other.outputType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputType, outputType);
    }

    @Override
    public String toString() {
        return RequestHandler.class.getName() + "<" + inputType.getTypeName() + ", " + outputType.getTypeName() + ">";
    }
}
