package com.mediator.generator.catalog;

import java.lang.reflect.Constructor;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.catalog.model.Accessibility;
import com.mediator.generator.catalog.model.BaseTypeClause;
import com.mediator.generator.catalog.model.ConstructorDescriptor;
import com.mediator.generator.catalog.model.DeclarationKind;
import com.mediator.generator.catalog.model.SourceLocation;
import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.catalog.model.TypeReference;

/**
 * Describes compiled library types (jars, class directories) by reading their
 * class metadata. Classes are loaded without initialization.
 *
 * Only used to resolve supertypes and the target contract; it never scans for
 * handlers.
 */
public class ClasspathTypeLookup implements TypeLookup {

    private static final Logger log = LoggerFactory.getLogger(ClasspathTypeLookup.class);

    /** Supertypes every class of a kind has without declaring them. */
    private static final Set<String> IMPLICIT_SUPERTYPES = Set.of(
            "java.lang.Object", "java.lang.Record", "java.lang.Enum");

    private final ClassLoader classLoader;
    private final Map<String, Optional<TypeDescriptor>> cache = new ConcurrentHashMap<>();

    public ClasspathTypeLookup(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Optional<TypeDescriptor> findType(String qualifiedName) {
        return cache.computeIfAbsent(qualifiedName, name -> loadClass(name)
                .filter(type -> type.getCanonicalName() != null)
                .map(this::describe));
    }

    /**
     * Tries {@code a.b.Outer.Inner}, then {@code a.b.Outer$Inner}, then
     * {@code a.b$Outer$Inner}.
     */
    private Optional<Class<?>> loadClass(String canonicalName) {
        String candidate = canonicalName;
        while (true) {
            try {
                return Optional.of(Class.forName(candidate, false, classLoader));
            } catch (ClassNotFoundException | LinkageError e) {
                log.trace("Class {} not loadable: {}", candidate, e.toString());
            }
            int lastDot = candidate.lastIndexOf('.');
            if (lastDot < 0) {
                return Optional.empty();
            }
            candidate = candidate.substring(0, lastDot) + "$" + candidate.substring(lastDot + 1);
        }
    }

    private TypeDescriptor describe(Class<?> type) {
        String name = type.getCanonicalName();
        SourceLocation location = SourceLocation.ofElement(name);

        TypeDescriptor.TypeDescriptorBuilder builder = TypeDescriptor.builder()
                .qualifiedName(name)
                .kind(kindOf(type))
                .accessibility(effectiveAccessibility(type))
                .isAbstract(Modifier.isAbstract(type.getModifiers()))
                .requiresEnclosingInstance(type.isMemberClass() && !Modifier.isStatic(type.getModifiers()))
                .location(location);

        for (TypeVariable<?> parameter : type.getTypeParameters()) {
            builder.typeParameter(parameter.getName());
        }

        Type superclass = type.getGenericSuperclass();
        if (superclass != null && !IMPLICIT_SUPERTYPES.contains(rawClass(superclass).getName())) {
            builder.baseType(BaseTypeClause.of(toReference(superclass), location));
        }
        for (Type iface : type.getGenericInterfaces()) {
            builder.baseType(BaseTypeClause.of(toReference(iface), location));
        }

        for (Constructor<?> constructor : type.getDeclaredConstructors()) {
            builder.constructor(ConstructorDescriptor.of(accessibilityOf(constructor.getModifiers())));
        }
        return builder.build();
    }

    static TypeReference toReference(Type type) {
        if (type instanceof Class<?> cls) {
            if (cls.isArray()) {
                return TypeReference.array(toReference(cls.getComponentType()));
            }
            return TypeReference.declared(cls.getCanonicalName() != null ? cls.getCanonicalName() : cls.getName());
        }
        if (type instanceof ParameterizedType parameterized) {
            List<TypeReference> arguments = new ArrayList<>();
            for (Type argument : parameterized.getActualTypeArguments()) {
                arguments.add(toReference(argument));
            }
            return TypeReference.declared(toReference(parameterized.getRawType()).getName(), arguments);
        }
        if (type instanceof TypeVariable<?> variable) {
            return TypeReference.typeVariable(variable.getName());
        }
        if (type instanceof GenericArrayType array) {
            return TypeReference.array(toReference(array.getGenericComponentType()));
        }
        if (type instanceof WildcardType wildcard) {
            if (wildcard.getLowerBounds().length > 0) {
                return TypeReference.wildcardSuper(toReference(wildcard.getLowerBounds()[0]));
            }
            Type upper = wildcard.getUpperBounds()[0];
            return upper == Object.class ? TypeReference.wildcard() : TypeReference.wildcardExtends(toReference(upper));
        }
        throw new IllegalArgumentException("Unsupported type: " + type);
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof ParameterizedType parameterized) {
            return (Class<?>) parameterized.getRawType();
        }
        return (Class<?>) type;
    }

    private static DeclarationKind kindOf(Class<?> type) {
        if (type.isAnnotation()) {
            return DeclarationKind.ANNOTATION;
        }
        if (type.isInterface()) {
            return DeclarationKind.INTERFACE;
        }
        if (type.isEnum()) {
            return DeclarationKind.ENUM;
        }
        if (type.isRecord()) {
            return DeclarationKind.RECORD;
        }
        return DeclarationKind.CLASS;
    }

    private static Accessibility effectiveAccessibility(Class<?> type) {
        Accessibility accessibility = accessibilityOf(type.getModifiers());
        for (Class<?> enclosing = type.getEnclosingClass(); enclosing != null; enclosing = enclosing.getEnclosingClass()) {
            accessibility = accessibility.restrictTo(accessibilityOf(enclosing.getModifiers()));
        }
        if (type.getPackageName().isEmpty()) {
            // unnamed-package types cannot be referenced from a named package
            accessibility = accessibility.restrictTo(Accessibility.PACKAGE_PRIVATE);
        }
        return accessibility;
    }

    private static Accessibility accessibilityOf(int modifiers) {
        if (Modifier.isPublic(modifiers)) {
            return Accessibility.PUBLIC;
        }
        if (Modifier.isProtected(modifiers)) {
            return Accessibility.PROTECTED;
        }
        if (Modifier.isPrivate(modifiers)) {
            return Accessibility.PRIVATE;
        }
        return Accessibility.PACKAGE_PRIVATE;
    }
}
