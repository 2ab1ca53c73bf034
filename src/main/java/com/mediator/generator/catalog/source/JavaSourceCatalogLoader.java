package com.mediator.generator.catalog.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.TypeParameter;
import com.mediator.generator.catalog.CatalogLoadException;
import com.mediator.generator.catalog.SnapshotTypeCatalog;
import com.mediator.generator.catalog.TypeLookup;
import com.mediator.generator.catalog.model.Accessibility;
import com.mediator.generator.catalog.model.BaseTypeClause;
import com.mediator.generator.catalog.model.ConstructorDescriptor;
import com.mediator.generator.catalog.model.DeclarationKind;
import com.mediator.generator.catalog.model.SourceLocation;
import com.mediator.generator.catalog.model.TypeDescriptor;

/**
 * Builds a type catalog from Java source trees.
 *
 * <p>Two passes: the first parses every file and collects the declared type names,
 * the second describes each top-level and member type, resolving supertype names
 * against the declared names and the fallback lookup. Local and anonymous classes
 * are not part of the catalog.
 *
 * <p>Files that fail to parse are logged and skipped.
 */
public class JavaSourceCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceCatalogLoader.class);

    private final SourceFileDiscoveryService discoveryService;
    private final TypeLookup fallback;
    private final JavaParser parser;

    public JavaSourceCatalogLoader(SourceFileDiscoveryService discoveryService, TypeLookup fallback) {
        this.discoveryService = discoveryService;
        this.fallback = fallback;
        ParserConfiguration configuration = new ParserConfiguration();
        configuration.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(configuration);
    }

    public SnapshotTypeCatalog load(List<Path> sourceRoots) {
        List<Path> files = discoveryService.discoverSourceFiles(sourceRoots);
        log.debug("Parsing {} source files", files.size());

        List<ParsedUnit> units = new ArrayList<>();
        Set<String> declaredNames = new HashSet<>();
        for (Path file : files) {
            CompilationUnit unit = parse(file);
            if (unit == null) {
                continue;
            }
            String packageName = unit.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
            for (TypeDeclaration<?> type : unit.getTypes()) {
                collectNames(type, packageName.isEmpty() ? "" : packageName + ".", declaredNames);
            }
            units.add(new ParsedUnit(file, unit));
        }

        List<TypeDescriptor> descriptors = new ArrayList<>();
        for (ParsedUnit parsed : units) {
            TypeNameResolver resolver = new TypeNameResolver(parsed.unit(),
                    name -> declaredNames.contains(name) || fallback.findType(name).isPresent());
            for (TypeDeclaration<?> type : parsed.unit().getTypes()) {
                describe(parsed.file(), type, null, resolver, descriptors);
            }
        }
        log.debug("Catalog holds {} declared types", descriptors.size());
        return new SnapshotTypeCatalog(descriptors, fallback);
    }

    private CompilationUnit parse(Path file) {
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(file);
        } catch (IOException e) {
            throw new CatalogLoadException(file, "Failed to read source file", e);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.warn("Skipping {}: {}", file, result.getProblems());
            return null;
        }
        return result.getResult().get();
    }

    private static void collectNames(TypeDeclaration<?> type, String prefix, Set<String> names) {
        String qualifiedName = prefix + type.getNameAsString();
        names.add(qualifiedName);
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                collectNames(nested, qualifiedName + ".", names);
            }
        }
    }

    private void describe(Path file, TypeDeclaration<?> type, Scope enclosing, TypeNameResolver resolver,
                          List<TypeDescriptor> out) {
        String qualifiedName = enclosing == null
                ? resolver.qualify(type.getNameAsString())
                : enclosing.qualifiedName() + "." + type.getNameAsString();
        DeclarationKind kind = kindOf(type);

        Set<String> typeVariables = new LinkedHashSet<>();
        List<String> ownParameters = typeParametersOf(type);
        typeVariables.addAll(ownParameters);
        if (enclosing != null && !isImplicitlyStatic(type, enclosing)) {
            typeVariables.addAll(enclosing.typeVariables());
        }
        List<String> enclosingTypes = new ArrayList<>();
        enclosingTypes.add(qualifiedName);
        if (enclosing != null) {
            enclosingTypes.addAll(enclosing.enclosingTypes());
        }

        Accessibility declared = declaredAccessibility(type, enclosing);
        Accessibility effective = enclosing == null ? declared : declared.restrictTo(enclosing.accessibility());
        if (resolver.getPackageName().isEmpty()) {
            // unnamed-package types cannot be referenced from a named package
            effective = effective.restrictTo(Accessibility.PACKAGE_PRIVATE);
        }

        TypeDescriptor.TypeDescriptorBuilder builder = TypeDescriptor.builder()
                .qualifiedName(qualifiedName)
                .kind(kind)
                .accessibility(effective)
                .isAbstract(kind == DeclarationKind.INTERFACE || kind == DeclarationKind.ANNOTATION
                        || type.hasModifier(Modifier.Keyword.ABSTRACT))
                .requiresEnclosingInstance(enclosing != null && kind == DeclarationKind.CLASS
                        && !isImplicitlyStatic(type, enclosing))
                .typeParameters(ownParameters)
                .location(locationOf(file, type.getName(), qualifiedName));

        for (ClassOrInterfaceType supertype : supertypesOf(type)) {
            builder.baseType(BaseTypeClause.of(
                    resolver.toReference(supertype, enclosingTypes, typeVariables),
                    locationOf(file, supertype, qualifiedName)));
        }
        for (ConstructorDescriptor constructor : constructorsOf(type, declared)) {
            builder.constructor(constructor);
        }
        out.add(builder.build());

        Scope scope = new Scope(qualifiedName, kind, effective, typeVariables, enclosingTypes);
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                describe(file, nested, scope, resolver, out);
            }
        }
    }

    private static DeclarationKind kindOf(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration declaration) {
            return declaration.isInterface() ? DeclarationKind.INTERFACE : DeclarationKind.CLASS;
        }
        if (type instanceof EnumDeclaration) {
            return DeclarationKind.ENUM;
        }
        if (type instanceof RecordDeclaration) {
            return DeclarationKind.RECORD;
        }
        if (type instanceof AnnotationDeclaration) {
            return DeclarationKind.ANNOTATION;
        }
        return DeclarationKind.CLASS;
    }

    private static List<String> typeParametersOf(TypeDeclaration<?> type) {
        List<String> names = new ArrayList<>();
        List<TypeParameter> parameters = List.of();
        if (type instanceof ClassOrInterfaceDeclaration declaration) {
            parameters = declaration.getTypeParameters();
        } else if (type instanceof RecordDeclaration declaration) {
            parameters = declaration.getTypeParameters();
        }
        for (TypeParameter parameter : parameters) {
            names.add(parameter.getNameAsString());
        }
        return names;
    }

    private static List<ClassOrInterfaceType> supertypesOf(TypeDeclaration<?> type) {
        List<ClassOrInterfaceType> supertypes = new ArrayList<>();
        if (type instanceof ClassOrInterfaceDeclaration declaration) {
            supertypes.addAll(declaration.getExtendedTypes());
            supertypes.addAll(declaration.getImplementedTypes());
        } else if (type instanceof EnumDeclaration declaration) {
            supertypes.addAll(declaration.getImplementedTypes());
        } else if (type instanceof RecordDeclaration declaration) {
            supertypes.addAll(declaration.getImplementedTypes());
        }
        return supertypes;
    }

    /**
     * Nested enums, records, interfaces and annotations are implicitly static, and so
     * is every member type of an interface or annotation.
     */
    private static boolean isImplicitlyStatic(TypeDeclaration<?> type, Scope enclosing) {
        if (type.hasModifier(Modifier.Keyword.STATIC)) {
            return true;
        }
        if (enclosing.kind() == DeclarationKind.INTERFACE || enclosing.kind() == DeclarationKind.ANNOTATION) {
            return true;
        }
        return kindOf(type) != DeclarationKind.CLASS;
    }

    private static Accessibility declaredAccessibility(NodeWithModifiers<?> node, Scope enclosing) {
        if (node.hasModifier(Modifier.Keyword.PUBLIC)) {
            return Accessibility.PUBLIC;
        }
        if (node.hasModifier(Modifier.Keyword.PROTECTED)) {
            return Accessibility.PROTECTED;
        }
        if (node.hasModifier(Modifier.Keyword.PRIVATE)) {
            return Accessibility.PRIVATE;
        }
        if (enclosing != null
                && (enclosing.kind() == DeclarationKind.INTERFACE || enclosing.kind() == DeclarationKind.ANNOTATION)) {
            return Accessibility.PUBLIC;
        }
        return Accessibility.PACKAGE_PRIVATE;
    }

    /**
     * Declared constructors, plus the ones the compiler adds: a default constructor
     * with the class's access when none is declared, a canonical constructor for
     * records. Enum constructors are always private.
     */
    private static List<ConstructorDescriptor> constructorsOf(TypeDeclaration<?> type, Accessibility typeAccess) {
        List<ConstructorDescriptor> constructors = new ArrayList<>();
        if (type instanceof EnumDeclaration) {
            constructors.add(ConstructorDescriptor.of(Accessibility.PRIVATE));
            return constructors;
        }
        if (!(type instanceof ClassOrInterfaceDeclaration || type instanceof RecordDeclaration)) {
            return constructors;
        }
        if (type instanceof ClassOrInterfaceDeclaration declaration && declaration.isInterface()) {
            return constructors;
        }
        for (ConstructorDeclaration constructor : type.getConstructors()) {
            constructors.add(ConstructorDescriptor.of(declaredAccessibility(constructor, null)));
        }
        if (type instanceof RecordDeclaration recordDeclaration) {
            recordDeclaration.getCompactConstructors().forEach(compact ->
                    constructors.add(ConstructorDescriptor.of(declaredAccessibility(compact, null))));
            int componentCount = recordDeclaration.getParameters().size();
            boolean canonicalDeclared = !recordDeclaration.getCompactConstructors().isEmpty()
                    || type.getConstructors().stream().anyMatch(c -> c.getParameters().size() == componentCount);
            if (!canonicalDeclared) {
                constructors.add(ConstructorDescriptor.of(typeAccess));
            }
        } else if (constructors.isEmpty()) {
            constructors.add(ConstructorDescriptor.of(typeAccess));
        }
        return constructors;
    }

    private static SourceLocation locationOf(Path file, Node node, String elementName) {
        Position begin = node.getBegin().orElse(null);
        if (begin == null) {
            return SourceLocation.of(file.toString(), 0, 0, elementName);
        }
        return SourceLocation.of(file.toString(), begin.line, begin.column, elementName);
    }

    private record ParsedUnit(Path file, CompilationUnit unit) {
    }

    private record Scope(String qualifiedName, DeclarationKind kind, Accessibility accessibility,
                         Set<String> typeVariables, List<String> enclosingTypes) {
    }
}
