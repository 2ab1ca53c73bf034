package com.mediator.generator.codegen.analysis;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.catalog.TypeLookup;
import com.mediator.generator.catalog.model.BaseTypeClause;
import com.mediator.generator.catalog.model.ContractInstantiation;
import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.catalog.model.TypeReference;

/**
 * Finds every instantiation of the contract a type implements, directly or through
 * any chain of superclasses and superinterfaces.
 *
 * Type variables are substituted on the way down: for
 * {@code class Concrete extends Base<Req>} and
 * {@code class Base<T> implements RequestHandler<T, String>} the match is
 * {@code RequestHandler<Req, String>}. A raw supertype erases everything reached
 * through it, so the match then has no type arguments.
 */
public class InterfaceMatcher {

    private static final Logger log = LoggerFactory.getLogger(InterfaceMatcher.class);

    private final TypeLookup lookup;
    private final String contractName;

    public InterfaceMatcher(TypeLookup lookup, String contractName) {
        this.lookup = lookup;
        this.contractName = contractName;
    }

    /**
     * Distinct contract instantiations in depth-first declaration order.
     */
    public List<ContractInstantiation> match(TypeDescriptor type) {
        Map<String, ContractInstantiation> found = new LinkedHashMap<>();
        Set<String> path = new HashSet<>();
        Set<String> expanded = new HashSet<>();
        path.add(type.getQualifiedName());

        Map<String, TypeReference> bindings = bind(type.getTypeParameters(), type.getTypeArguments());
        for (BaseTypeClause clause : type.getBaseTypes()) {
            visit(clause.getType().substitute(bindings), clause, false, found, path, expanded);
        }
        return List.copyOf(found.values());
    }

    private void visit(TypeReference supertype, BaseTypeClause via, boolean erased,
                       Map<String, ContractInstantiation> found, Set<String> path, Set<String> expanded) {
        if (supertype.getKind() != TypeReference.Kind.DECLARED) {
            return;
        }
        TypeReference reference = erased ? supertype.erasure() : supertype;

        if (reference.getName().equals(contractName)) {
            ContractInstantiation instantiation =
                    new ContractInstantiation(contractName, reference.getTypeArguments(), via);
            found.putIfAbsent(instantiation.toDisplayString(), instantiation);
            return;
        }

        // each substituted supertype is expanded once; the name path cuts cycles whose arguments keep growing
        String key = (erased ? "raw " : "") + reference.toDisplayString();
        if (!expanded.add(key) || !path.add(reference.getName())) {
            return;
        }
        Optional<TypeDescriptor> declaration = lookup.findType(reference.getName());
        if (declaration.isPresent()) {
            TypeDescriptor declared = declaration.get();
            boolean raw = !reference.hasTypeArguments() && declared.getGenericArity() > 0;
            boolean eraseBelow = erased || raw;
            Map<String, TypeReference> bindings = eraseBelow
                    ? Map.of()
                    : bind(declared.getTypeParameters(), reference.getTypeArguments());
            for (BaseTypeClause clause : declared.getBaseTypes()) {
                visit(clause.getType().substitute(bindings), via, eraseBelow, found, path, expanded);
            }
        } else {
            log.debug("Supertype {} not resolvable, skipping its hierarchy", reference.getName());
        }
        path.remove(reference.getName());
    }

    private static Map<String, TypeReference> bind(List<String> parameters, List<TypeReference> arguments) {
        if (parameters.isEmpty() || arguments.isEmpty()) {
            return Map.of();
        }
        Map<String, TypeReference> bindings = new HashMap<>();
        int count = Math.min(parameters.size(), arguments.size());
        for (int i = 0; i < count; i++) {
            bindings.put(parameters.get(i), arguments.get(i));
        }
        return bindings;
    }
}
