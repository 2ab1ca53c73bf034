package com.mediator.generator.catalog.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mediator.generator.catalog.CatalogLoadException;
import com.mediator.generator.catalog.ClasspathTypeLookup;
import com.mediator.generator.catalog.SnapshotTypeCatalog;
import com.mediator.generator.catalog.model.Accessibility;
import com.mediator.generator.catalog.model.BaseTypeClause;
import com.mediator.generator.catalog.model.ConstructorDescriptor;
import com.mediator.generator.catalog.model.DeclarationKind;
import com.mediator.generator.catalog.model.TypeDescriptor;

class JavaSourceCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private SnapshotTypeCatalog load() {
        JavaSourceCatalogLoader loader = new JavaSourceCatalogLoader(new SourceFileDiscoveryService(),
                new ClasspathTypeLookup(getClass().getClassLoader()));
        return loader.load(List.of(tempDir));
    }

    private void write(String relativePath, String source) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, source);
    }

    private static TypeDescriptor find(SnapshotTypeCatalog catalog, String name) {
        return catalog.getDeclaredTypes().stream()
                .filter(t -> t.getQualifiedName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("Type not in catalog: " + name));
    }

    private static List<String> baseTypes(TypeDescriptor type) {
        return type.getBaseTypes().stream().map(c -> c.getType().toDisplayString()).toList();
    }

    @Test
    void testResolvesImportedContractAndSamePackageTypes() throws IOException {
        write("com/acme/GetUser.java", """
                package com.acme;

                public record GetUser(String id) {
                }
                """);
        write("com/acme/GetUserHandler.java", """
                package com.acme;

                import java.util.List;
                import java.util.concurrent.CompletableFuture;
                import com.mediator.api.RequestHandler;

                public class GetUserHandler implements RequestHandler<GetUser, List<String>> {
                    @Override
                    public CompletableFuture<List<String>> handle(GetUser input) {
                        return CompletableFuture.completedFuture(List.of());
                    }
                }
                """);

        TypeDescriptor handler = find(load(), "com.acme.GetUserHandler");

        assertThat(baseTypes(handler)).containsExactly(
                "com.mediator.api.RequestHandler<com.acme.GetUser, java.util.List<java.lang.String>>");
        assertThat(handler.getAccessibility()).isEqualTo(Accessibility.PUBLIC);
        assertThat(handler.getConstructors()).containsExactly(ConstructorDescriptor.of(Accessibility.PUBLIC));
        BaseTypeClause clause = handler.getBaseTypes().get(0);
        assertThat(clause.getLocation().getLine()).isEqualTo(7);
        assertThat(clause.getLocation().getPath()).endsWith("GetUserHandler.java");
    }

    @Test
    void testWildcardImportAndJavaLang() throws IOException {
        write("com/acme/PingHandler.java", """
                package com.acme;

                import com.mediator.api.*;

                public class PingHandler implements RequestHandler<Integer, String> {
                    public java.util.concurrent.CompletableFuture<String> handle(Integer input) {
                        return null;
                    }
                }
                """);

        assertThat(baseTypes(find(load(), "com.acme.PingHandler")))
                .containsExactly("com.mediator.api.RequestHandler<java.lang.Integer, java.lang.String>");
    }

    @Test
    void testNestedTypesAndAccessibility() throws IOException {
        write("com/acme/Outer.java", """
                package com.acme;

                public class Outer {
                    public static class Nested {
                    }
                    public class Inner {
                    }
                    private static class Hidden {
                    }
                    public interface Port {
                        class Impl {
                        }
                    }
                    static class PackageLevel {
                    }
                }
                """);

        SnapshotTypeCatalog catalog = load();

        TypeDescriptor nested = find(catalog, "com.acme.Outer.Nested");
        assertThat(nested.getAccessibility()).isEqualTo(Accessibility.PUBLIC);
        assertThat(nested.isRequiresEnclosingInstance()).isFalse();
        assertThat(find(catalog, "com.acme.Outer.Inner").isRequiresEnclosingInstance()).isTrue();
        assertThat(find(catalog, "com.acme.Outer.Hidden").getAccessibility()).isEqualTo(Accessibility.PRIVATE);
        assertThat(find(catalog, "com.acme.Outer.PackageLevel").getAccessibility())
                .isEqualTo(Accessibility.PACKAGE_PRIVATE);
        TypeDescriptor impl = find(catalog, "com.acme.Outer.Port.Impl");
        assertThat(impl.getAccessibility()).isEqualTo(Accessibility.PUBLIC);
        assertThat(impl.isRequiresEnclosingInstance()).isFalse();
        TypeDescriptor port = find(catalog, "com.acme.Outer.Port");
        assertThat(port.getKind()).isEqualTo(DeclarationKind.INTERFACE);
        assertThat(port.isAbstract()).isTrue();
    }

    @Test
    void testNestedTypeReferencedBySimpleName() throws IOException {
        write("com/acme/Requests.java", """
                package com.acme;

                import com.mediator.api.RequestHandler;

                public class Requests {
                    public record Ping() {
                    }

                    public static class PingHandler implements RequestHandler<Ping, String> {
                        public java.util.concurrent.CompletableFuture<String> handle(Ping input) {
                            return null;
                        }
                    }
                }
                """);

        assertThat(baseTypes(find(load(), "com.acme.Requests.PingHandler")))
                .containsExactly("com.mediator.api.RequestHandler<com.acme.Requests.Ping, java.lang.String>");
    }

    @Test
    void testGenericBaseClassKeepsTypeVariables() throws IOException {
        write("com/acme/BaseHandler.java", """
                package com.acme;

                import com.mediator.api.RequestHandler;

                public abstract class BaseHandler<T> implements RequestHandler<T, String> {
                }
                """);
        write("com/acme/ConcreteHandler.java", """
                package com.acme;

                public class ConcreteHandler extends BaseHandler<Query> {
                    public java.util.concurrent.CompletableFuture<String> handle(Query input) {
                        return null;
                    }
                }
                """);
        write("com/acme/Query.java", """
                package com.acme;

                public class Query {
                }
                """);

        SnapshotTypeCatalog catalog = load();

        TypeDescriptor base = find(catalog, "com.acme.BaseHandler");
        assertThat(base.isAbstract()).isTrue();
        assertThat(base.getTypeParameters()).containsExactly("T");
        assertThat(base.getBaseTypes().get(0).getType().getTypeArguments().get(0).isTypeVariable()).isTrue();
        assertThat(baseTypes(find(catalog, "com.acme.ConcreteHandler")))
                .containsExactly("com.acme.BaseHandler<com.acme.Query>");
    }

    @Test
    void testImplicitAndDeclaredConstructors() throws IOException {
        write("com/acme/Ctors.java", """
                package com.acme;

                class Ctors {
                    public static final class Singleton {
                        private Singleton() {
                        }
                    }
                    public enum Mode { ON, OFF }
                    public record Point(int x, int y) {
                    }
                }
                """);

        SnapshotTypeCatalog catalog = load();

        assertThat(find(catalog, "com.acme.Ctors").getConstructors())
                .containsExactly(ConstructorDescriptor.of(Accessibility.PACKAGE_PRIVATE));
        assertThat(find(catalog, "com.acme.Ctors.Singleton").getConstructors())
                .containsExactly(ConstructorDescriptor.of(Accessibility.PRIVATE));
        assertThat(find(catalog, "com.acme.Ctors.Mode").getConstructors())
                .containsExactly(ConstructorDescriptor.of(Accessibility.PRIVATE));
        TypeDescriptor point = find(catalog, "com.acme.Ctors.Point");
        assertThat(point.getKind()).isEqualTo(DeclarationKind.RECORD);
        // nested in a package-private class
        assertThat(point.getAccessibility()).isEqualTo(Accessibility.PACKAGE_PRIVATE);
        assertThat(point.getConstructors()).containsExactly(ConstructorDescriptor.of(Accessibility.PUBLIC));
    }

    @Test
    void testUnnamedPackageIsNotReachable() throws IOException {
        write("Loose.java", """
                public class Loose {
                }
                """);

        TypeDescriptor loose = find(load(), "Loose");

        assertThat(loose.getAccessibility()).isEqualTo(Accessibility.PACKAGE_PRIVATE);
    }

    @Test
    void testUnparseableFileIsSkipped() throws IOException {
        write("com/acme/Broken.java", """
                package com.acme;

                public class Broken {
                """);
        write("com/acme/Fine.java", """
                package com.acme;

                public class Fine {
                }
                """);

        SnapshotTypeCatalog catalog = load();

        assertThat(catalog.getDeclaredTypes()).extracting(TypeDescriptor::getQualifiedName)
                .containsExactly("com.acme.Fine");
    }

    @Test
    void testOverlappingSourceRootsDescribeEachTypeOnce() throws IOException {
        write("com/acme/PingHandler.java", """
                package com.acme;

                import com.mediator.api.RequestHandler;

                public class PingHandler implements RequestHandler<Integer, String> {
                    public java.util.concurrent.CompletableFuture<String> handle(Integer input) {
                        return null;
                    }
                }
                """);
        JavaSourceCatalogLoader loader = new JavaSourceCatalogLoader(new SourceFileDiscoveryService(),
                new ClasspathTypeLookup(getClass().getClassLoader()));

        SnapshotTypeCatalog catalog = loader.load(List.of(tempDir, tempDir.resolve("com")));

        assertThat(catalog.getDeclaredTypes()).extracting(TypeDescriptor::getQualifiedName)
                .containsExactly("com.acme.PingHandler");
    }

    @Test
    void testContractResolvesThroughFallback() {
        assertThat(load().findType("com.mediator.api.RequestHandler")).isPresent();
    }

    @Test
    void testMissingSourceRootFails() {
        JavaSourceCatalogLoader loader = new JavaSourceCatalogLoader(new SourceFileDiscoveryService(),
                name -> java.util.Optional.empty());

        assertThatThrownBy(() -> loader.load(List.of(tempDir.resolve("missing"))))
                .isInstanceOf(CatalogLoadException.class)
                .hasMessageContaining("missing");
    }
}
