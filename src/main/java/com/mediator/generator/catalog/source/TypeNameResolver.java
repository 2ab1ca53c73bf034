package com.mediator.generator.catalog.source;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.WildcardType;
import com.mediator.generator.catalog.model.TypeReference;

/**
 * Resolves type names written in one compilation unit to canonical names, following
 * the Java scoping rules closely enough for supertype clauses:
 * type variables, enclosing and member types, single-type imports, the current
 * package, on-demand imports, then {@code java.lang}.
 *
 * A name that matches nothing is assumed to live in the current package, with a
 * warning: it usually means a dependency is missing from the class path.
 */
class TypeNameResolver {

    private static final Logger log = LoggerFactory.getLogger(TypeNameResolver.class);

    private final String packageName;
    private final List<String> singleTypeImports = new ArrayList<>();
    private final List<String> onDemandImports = new ArrayList<>();
    private final Predicate<String> knownType;
    private final Set<String> assumedNames = new LinkedHashSet<>();

    TypeNameResolver(CompilationUnit unit, Predicate<String> knownType) {
        this.packageName = unit.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        this.knownType = knownType;
        for (ImportDeclaration declaration : unit.getImports()) {
            if (declaration.isStatic()) {
                continue;
            }
            if (declaration.isAsterisk()) {
                onDemandImports.add(declaration.getNameAsString());
            } else {
                singleTypeImports.add(declaration.getNameAsString());
            }
        }
    }

    String getPackageName() {
        return packageName;
    }

    /**
     * Names that resolved to nothing and were placed in the current package.
     */
    Set<String> getAssumedNames() {
        return Set.copyOf(assumedNames);
    }

    String qualify(String simpleName) {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    /**
     * @param enclosingTypes qualified names of the enclosing declarations, innermost first
     * @param typeVariables  type parameter names in scope
     */
    TypeReference toReference(Type type, List<String> enclosingTypes, Set<String> typeVariables) {
        if (type instanceof ClassOrInterfaceType classType) {
            if (classType.getScope().isEmpty() && typeVariables.contains(classType.getNameAsString())) {
                return TypeReference.typeVariable(classType.getNameAsString());
            }
            List<TypeReference> arguments = new ArrayList<>();
            NodeList<Type> typeArguments = classType.getTypeArguments().orElse(new NodeList<>());
            for (Type argument : typeArguments) {
                arguments.add(toReference(argument, enclosingTypes, typeVariables));
            }
            return TypeReference.declared(resolveName(classType, enclosingTypes), arguments);
        }
        if (type instanceof ArrayType arrayType) {
            return TypeReference.array(toReference(arrayType.getComponentType(), enclosingTypes, typeVariables));
        }
        if (type instanceof WildcardType wildcard) {
            if (wildcard.getExtendedType().isPresent()) {
                return TypeReference.wildcardExtends(
                        toReference(wildcard.getExtendedType().get(), enclosingTypes, typeVariables));
            }
            if (wildcard.getSuperType().isPresent()) {
                return TypeReference.wildcardSuper(
                        toReference(wildcard.getSuperType().get(), enclosingTypes, typeVariables));
            }
            return TypeReference.wildcard();
        }
        // primitives (array components) and anything else keep their source text
        return TypeReference.declared(type.asString());
    }

    String resolveName(ClassOrInterfaceType type, List<String> enclosingTypes) {
        Optional<String> known = resolveKnown(type, enclosingTypes);
        if (known.isPresent()) {
            return known.get();
        }
        if (type.getScope().isPresent()) {
            return type.getNameWithScope();
        }
        String assumed = qualify(type.getNameAsString());
        if (assumedNames.add(assumed)) {
            log.warn("Cannot resolve type {} in package '{}', assuming {}; check the class path",
                    type.getNameAsString(), packageName, assumed);
        }
        return assumed;
    }

    private Optional<String> resolveKnown(ClassOrInterfaceType type, List<String> enclosingTypes) {
        String name = type.getNameAsString();
        if (type.getScope().isPresent()) {
            Optional<String> scope = resolveKnown(type.getScope().get(), enclosingTypes);
            if (scope.isPresent()) {
                return Optional.of(scope.get() + "." + name).filter(knownType);
            }
            return Optional.of(type.getNameWithScope()).filter(knownType);
        }
        return resolveSimpleName(name, enclosingTypes);
    }

    private Optional<String> resolveSimpleName(String name, List<String> enclosingTypes) {
        for (String enclosing : enclosingTypes) {
            if (enclosing.equals(name) || enclosing.endsWith("." + name)) {
                return Optional.of(enclosing);
            }
            String member = enclosing + "." + name;
            if (knownType.test(member)) {
                return Optional.of(member);
            }
        }
        for (String imported : singleTypeImports) {
            if (imported.equals(name) || imported.endsWith("." + name)) {
                return Optional.of(imported);
            }
        }
        String samePackage = qualify(name);
        if (knownType.test(samePackage)) {
            return Optional.of(samePackage);
        }
        for (String onDemand : onDemandImports) {
            String candidate = onDemand + "." + name;
            if (knownType.test(candidate)) {
                return Optional.of(candidate);
            }
        }
        String javaLang = "java.lang." + name;
        if (knownType.test(javaLang)) {
            return Optional.of(javaLang);
        }
        return Optional.empty();
    }
}
