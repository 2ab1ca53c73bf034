package com.mediator.generator.processor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.TypeParameterElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.TypeVariable;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;

import com.mediator.generator.catalog.TypeCatalog;
import com.mediator.generator.catalog.model.Accessibility;
import com.mediator.generator.catalog.model.BaseTypeClause;
import com.mediator.generator.catalog.model.ConstructorDescriptor;
import com.mediator.generator.catalog.model.DeclarationKind;
import com.mediator.generator.catalog.model.SourceLocation;
import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.catalog.model.TypeReference;

/**
 * Type catalog over the elements of one compilation. Declared types are the root
 * types of the round and their member types; anything else is looked up through
 * {@link Elements}, so the contract and library supertypes resolve from the
 * compilation's class path.
 */
class ElementTypeCatalog implements TypeCatalog {

    private static final Set<String> IMPLICIT_SUPERTYPES = Set.of(
            "java.lang.Object", "java.lang.Record", "java.lang.Enum");

    private final Elements elements;
    private final List<TypeDescriptor> declaredTypes;
    private final Map<String, Optional<TypeDescriptor>> cache = new ConcurrentHashMap<>();

    ElementTypeCatalog(Elements elements, List<TypeElement> rootTypes) {
        this.elements = elements;
        List<TypeDescriptor> declared = new ArrayList<>();
        for (TypeElement root : rootTypes) {
            collect(root, declared);
        }
        this.declaredTypes = List.copyOf(declared);
    }

    private void collect(TypeElement type, List<TypeDescriptor> out) {
        TypeDescriptor descriptor = describe(type);
        cache.putIfAbsent(descriptor.getQualifiedName(), Optional.of(descriptor));
        out.add(descriptor);
        for (TypeElement member : ElementFilter.typesIn(type.getEnclosedElements())) {
            collect(member, out);
        }
    }

    @Override
    public List<TypeDescriptor> getDeclaredTypes() {
        return declaredTypes;
    }

    @Override
    public Optional<TypeDescriptor> findType(String qualifiedName) {
        return cache.computeIfAbsent(qualifiedName,
                name -> Optional.ofNullable(elements.getTypeElement(name)).map(this::describe));
    }

    private TypeDescriptor describe(TypeElement type) {
        String name = type.getQualifiedName().toString();
        DeclarationKind kind = kindOf(type);
        SourceLocation location = SourceLocation.ofElement(name);

        TypeDescriptor.TypeDescriptorBuilder builder = TypeDescriptor.builder()
                .qualifiedName(name)
                .kind(kind)
                .accessibility(effectiveAccessibility(type))
                .isAbstract(type.getModifiers().contains(Modifier.ABSTRACT)
                        || kind == DeclarationKind.INTERFACE || kind == DeclarationKind.ANNOTATION)
                .requiresEnclosingInstance(type.getNestingKind() == NestingKind.MEMBER
                        && kind == DeclarationKind.CLASS
                        && !type.getModifiers().contains(Modifier.STATIC))
                .location(location);

        for (TypeParameterElement parameter : type.getTypeParameters()) {
            builder.typeParameter(parameter.getSimpleName().toString());
        }

        TypeMirror superclass = type.getSuperclass();
        if (superclass.getKind() == TypeKind.DECLARED
                && !IMPLICIT_SUPERTYPES.contains(erasedName((DeclaredType) superclass))) {
            builder.baseType(BaseTypeClause.of(toReference(superclass), location));
        }
        for (TypeMirror iface : type.getInterfaces()) {
            builder.baseType(BaseTypeClause.of(toReference(iface), location));
        }

        for (ExecutableElement constructor : ElementFilter.constructorsIn(type.getEnclosedElements())) {
            builder.constructor(ConstructorDescriptor.of(accessibilityOf(constructor)));
        }
        return builder.build();
    }

    static TypeReference toReference(TypeMirror mirror) {
        switch (mirror.getKind()) {
            case DECLARED: {
                DeclaredType declared = (DeclaredType) mirror;
                List<TypeReference> arguments = new ArrayList<>();
                for (TypeMirror argument : declared.getTypeArguments()) {
                    arguments.add(toReference(argument));
                }
                return TypeReference.declared(erasedName(declared), arguments);
            }
            case TYPEVAR:
                return TypeReference.typeVariable(((TypeVariable) mirror).asElement().getSimpleName().toString());
            case ARRAY:
                return TypeReference.array(toReference(((ArrayType) mirror).getComponentType()));
            case WILDCARD: {
                WildcardType wildcard = (WildcardType) mirror;
                if (wildcard.getExtendsBound() != null) {
                    return TypeReference.wildcardExtends(toReference(wildcard.getExtendsBound()));
                }
                if (wildcard.getSuperBound() != null) {
                    return TypeReference.wildcardSuper(toReference(wildcard.getSuperBound()));
                }
                return TypeReference.wildcard();
            }
            default:
                // primitives and unresolved (error) types keep their source spelling
                return TypeReference.declared(mirror.toString());
        }
    }

    private static String erasedName(DeclaredType declared) {
        return ((TypeElement) declared.asElement()).getQualifiedName().toString();
    }

    private static DeclarationKind kindOf(TypeElement type) {
        ElementKind kind = type.getKind();
        if (kind == ElementKind.INTERFACE) {
            return DeclarationKind.INTERFACE;
        }
        if (kind == ElementKind.ANNOTATION_TYPE) {
            return DeclarationKind.ANNOTATION;
        }
        if (kind == ElementKind.ENUM) {
            return DeclarationKind.ENUM;
        }
        if (kind == ElementKind.RECORD) {
            return DeclarationKind.RECORD;
        }
        return DeclarationKind.CLASS;
    }

    private static Accessibility effectiveAccessibility(TypeElement type) {
        Accessibility accessibility = accessibilityOf(type);
        Element enclosing = type.getEnclosingElement();
        while (enclosing instanceof TypeElement enclosingType) {
            accessibility = accessibility.restrictTo(accessibilityOf(enclosingType));
            enclosing = enclosingType.getEnclosingElement();
        }
        if (enclosing instanceof PackageElement packageElement && packageElement.isUnnamed()) {
            // unnamed-package types cannot be referenced from a named package
            accessibility = accessibility.restrictTo(Accessibility.PACKAGE_PRIVATE);
        }
        return accessibility;
    }

    private static Accessibility accessibilityOf(Element element) {
        Set<Modifier> modifiers = element.getModifiers();
        if (modifiers.contains(Modifier.PUBLIC)) {
            return Accessibility.PUBLIC;
        }
        if (modifiers.contains(Modifier.PROTECTED)) {
            return Accessibility.PROTECTED;
        }
        if (modifiers.contains(Modifier.PRIVATE)) {
            return Accessibility.PRIVATE;
        }
        ElementKind enclosingKind = element.getEnclosingElement().getKind();
        if (element instanceof TypeElement
                && (enclosingKind == ElementKind.INTERFACE || enclosingKind == ElementKind.ANNOTATION_TYPE)) {
            return Accessibility.PUBLIC;
        }
        return Accessibility.PACKAGE_PRIVATE;
    }
}
