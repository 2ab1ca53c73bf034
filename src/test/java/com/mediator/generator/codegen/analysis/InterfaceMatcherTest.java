package com.mediator.generator.codegen.analysis;

import static com.mediator.generator.CatalogFixtures.CONTRACT;
import static com.mediator.generator.CatalogFixtures.concrete;
import static com.mediator.generator.CatalogFixtures.contract;
import static com.mediator.generator.CatalogFixtures.handlerOf;
import static com.mediator.generator.CatalogFixtures.type;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.mediator.generator.catalog.SnapshotTypeCatalog;
import com.mediator.generator.catalog.model.BaseTypeClause;
import com.mediator.generator.catalog.model.ContractInstantiation;
import com.mediator.generator.catalog.model.DeclarationKind;
import com.mediator.generator.catalog.model.SourceLocation;
import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.catalog.model.TypeReference;

class InterfaceMatcherTest {

    private static List<ContractInstantiation> match(TypeDescriptor type, TypeDescriptor... others) {
        TypeDescriptor[] all = new TypeDescriptor[others.length + 2];
        all[0] = contract();
        all[1] = type;
        System.arraycopy(others, 0, all, 2, others.length);
        return new InterfaceMatcher(SnapshotTypeCatalog.of(all), CONTRACT).match(type);
    }

    @Test
    void testDirectImplementation() {
        TypeDescriptor handler = concrete("com.acme.PingHandler",
                handlerOf(type("com.acme.Ping"), type("com.acme.Pong"))).build();

        List<ContractInstantiation> matches = match(handler);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).toDisplayString())
                .isEqualTo("com.mediator.api.RequestHandler<com.acme.Ping, com.acme.Pong>");
    }

    @Test
    void testNoContractNoMatch() {
        TypeDescriptor task = concrete("com.acme.Task", type("java.lang.Runnable")).build();

        assertThat(match(task)).isEmpty();
    }

    @Test
    void testInheritedThroughGenericBaseClassSubstitutesArguments() {
        TypeDescriptor base = TypeDescriptor.builder()
                .qualifiedName("com.acme.BaseHandler")
                .isAbstract(true)
                .typeParameter("T")
                .baseType(BaseTypeClause.of(handlerOf(TypeReference.typeVariable("T"), type("java.lang.String"))))
                .build();
        BaseTypeClause clause = BaseTypeClause.of(type("com.acme.BaseHandler", type("com.acme.Query")),
                SourceLocation.of("Concrete.java", 3, 30, "com.acme.Concrete"));
        TypeDescriptor concrete = concrete("com.acme.Concrete").baseType(clause).build();

        List<ContractInstantiation> matches = match(concrete, base);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).getTypeArguments())
                .extracting(TypeReference::toDisplayString)
                .containsExactly("com.acme.Query", "java.lang.String");
        assertThat(matches.get(0).getVia()).isEqualTo(clause);
    }

    @Test
    void testInheritedThroughSuperinterface() {
        TypeDescriptor command = TypeDescriptor.builder()
                .qualifiedName("com.acme.CommandHandler")
                .kind(DeclarationKind.INTERFACE)
                .isAbstract(true)
                .typeParameter("C")
                .baseType(BaseTypeClause.of(handlerOf(TypeReference.typeVariable("C"), type("java.lang.Void"))))
                .build();
        TypeDescriptor handler = concrete("com.acme.CreateUserHandler",
                type("com.acme.CommandHandler", type("com.acme.CreateUser"))).build();

        List<ContractInstantiation> matches = match(handler, command);

        assertThat(matches).extracting(ContractInstantiation::toDisplayString)
                .containsExactly("com.mediator.api.RequestHandler<com.acme.CreateUser, java.lang.Void>");
    }

    @Test
    void testRawSupertypeErasesContractArguments() {
        TypeDescriptor base = TypeDescriptor.builder()
                .qualifiedName("com.acme.BaseHandler")
                .isAbstract(true)
                .typeParameter("T")
                .baseType(BaseTypeClause.of(handlerOf(TypeReference.typeVariable("T"), type("java.lang.String"))))
                .build();
        TypeDescriptor rawUser = concrete("com.acme.RawUser", type("com.acme.BaseHandler")).build();

        List<ContractInstantiation> matches = match(rawUser, base);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).getArity()).isZero();
    }

    @Test
    void testRawContractHasNoArguments() {
        TypeDescriptor handler = concrete("com.acme.RawHandler", type(CONTRACT)).build();

        assertThat(match(handler)).extracting(ContractInstantiation::getArity).containsExactly(0);
    }

    @Test
    void testDiamondReportsInstantiationOnce() {
        TypeReference contractUse = handlerOf(type("com.acme.Ping"), type("com.acme.Pong"));
        TypeDescriptor left = TypeDescriptor.builder().qualifiedName("com.acme.Left")
                .kind(DeclarationKind.INTERFACE).isAbstract(true)
                .baseType(BaseTypeClause.of(contractUse)).build();
        TypeDescriptor right = TypeDescriptor.builder().qualifiedName("com.acme.Right")
                .kind(DeclarationKind.INTERFACE).isAbstract(true)
                .baseType(BaseTypeClause.of(contractUse)).build();
        TypeDescriptor handler = concrete("com.acme.Both", type("com.acme.Left"), type("com.acme.Right")).build();

        assertThat(match(handler, left, right)).hasSize(1);
    }

    @Test
    @Timeout(5)
    void testDeepDiamondLatticeIsWalkedOnce() {
        int depth = 40;
        List<TypeDescriptor> lattice = new ArrayList<>();
        TypeReference contractUse = handlerOf(type("com.acme.Ping"), type("java.lang.String"));
        lattice.add(latticeInterface("com.acme.I0", contractUse));
        lattice.add(latticeInterface("com.acme.J0", contractUse));
        for (int level = 1; level <= depth; level++) {
            TypeReference[] parents = {type("com.acme.I" + (level - 1)), type("com.acme.J" + (level - 1))};
            lattice.add(latticeInterface("com.acme.I" + level, parents));
            lattice.add(latticeInterface("com.acme.J" + level, parents));
        }
        TypeDescriptor handler = concrete("com.acme.LatticeHandler", type("com.acme.I" + depth)).build();

        List<ContractInstantiation> matches = match(handler, lattice.toArray(new TypeDescriptor[0]));

        assertThat(matches).extracting(ContractInstantiation::toDisplayString)
                .containsExactly("com.mediator.api.RequestHandler<com.acme.Ping, java.lang.String>");
    }

    @Test
    void testSameInterfaceReachedRawAndParameterizedKeepsBothForms() {
        TypeDescriptor base = TypeDescriptor.builder()
                .qualifiedName("com.acme.BaseHandler")
                .kind(DeclarationKind.INTERFACE)
                .isAbstract(true)
                .typeParameter("T")
                .baseType(BaseTypeClause.of(handlerOf(TypeReference.typeVariable("T"), type("java.lang.String"))))
                .build();
        TypeDescriptor handler = concrete("com.acme.Mixed",
                type("com.acme.BaseHandler"), type("com.acme.BaseHandler", type("com.acme.Ping"))).build();

        assertThat(match(handler, base)).extracting(ContractInstantiation::getArity).containsExactly(0, 2);
    }

    private static TypeDescriptor latticeInterface(String name, TypeReference... supertypes) {
        TypeDescriptor.TypeDescriptorBuilder builder = TypeDescriptor.builder().qualifiedName(name)
                .kind(DeclarationKind.INTERFACE).isAbstract(true);
        for (TypeReference supertype : supertypes) {
            builder.baseType(BaseTypeClause.of(supertype));
        }
        return builder.build();
    }

    @Test
    void testDistinctInstantiationsAreAllReturnedInDeclarationOrder() {
        TypeDescriptor handler = concrete("com.acme.Multi",
                handlerOf(type("com.acme.A"), type("com.acme.B")),
                handlerOf(type("com.acme.C"), type("com.acme.D"))).build();

        assertThat(match(handler)).extracting(ContractInstantiation::toDisplayString).containsExactly(
                "com.mediator.api.RequestHandler<com.acme.A, com.acme.B>",
                "com.mediator.api.RequestHandler<com.acme.C, com.acme.D>");
    }

    @Test
    void testCyclicHierarchyTerminates() {
        TypeDescriptor a = TypeDescriptor.builder().qualifiedName("com.acme.A")
                .kind(DeclarationKind.INTERFACE).isAbstract(true)
                .baseType(BaseTypeClause.of(type("com.acme.B"))).build();
        TypeDescriptor b = TypeDescriptor.builder().qualifiedName("com.acme.B")
                .kind(DeclarationKind.INTERFACE).isAbstract(true)
                .baseType(BaseTypeClause.of(type("com.acme.A"))).build();
        TypeDescriptor handler = concrete("com.acme.Looping", type("com.acme.A")).build();

        assertThat(match(handler, a, b)).isEmpty();
    }

    @Test
    void testUnresolvableSupertypeIsSkipped() {
        TypeDescriptor handler = concrete("com.acme.Orphan", type("com.missing.Base"),
                handlerOf(type("com.acme.Ping"), type("com.acme.Pong"))).build();

        assertThat(match(handler)).hasSize(1);
    }
}
