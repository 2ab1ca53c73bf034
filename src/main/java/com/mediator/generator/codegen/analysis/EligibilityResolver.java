package com.mediator.generator.codegen.analysis;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.catalog.TypeLookup;
import com.mediator.generator.catalog.model.ConstructorDescriptor;
import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.catalog.model.TypeReference;

import lombok.RequiredArgsConstructor;

/**
 * Resolves a candidate and keeps it only if a container could instantiate it.
 *
 * Rejections are silent: they are logged at debug level but never reported as
 * diagnostics. Rules are applied in order and the first match rejects:
 * <ol>
 *   <li>the name does not resolve in the catalog</li>
 *   <li>abstract (including interfaces) or static</li>
 *   <li>neither public nor internal</li>
 *   <li>generic definition without type arguments</li>
 *   <li>a type argument that is still a type variable</li>
 *   <li>no non-static public or internal constructor</li>
 * </ol>
 */
@RequiredArgsConstructor
public class EligibilityResolver {

    private static final Logger log = LoggerFactory.getLogger(EligibilityResolver.class);

    private final TypeLookup lookup;

    public Optional<TypeDescriptor> resolve(TypeDescriptor candidate) {
        Optional<TypeDescriptor> resolved = lookup.findType(candidate.getQualifiedName());
        if (resolved.isEmpty()) {
            return reject(candidate, "not resolvable");
        }
        TypeDescriptor type = resolved.get();

        if (type.isAbstract() || type.isStatic()) {
            return reject(type, "abstract or static");
        }
        if (!type.getAccessibility().isContainerAccessible()) {
            return reject(type, "accessibility " + type.getAccessibility());
        }
        if (type.isUnboundGenericDefinition()) {
            return reject(type, "unbound generic definition");
        }
        if (type.getTypeArguments().stream().anyMatch(TypeReference::isTypeVariable)) {
            return reject(type, "open generic type arguments");
        }
        if (!hasUsableConstructor(type)) {
            return reject(type, "no accessible instance constructor");
        }
        return Optional.of(type);
    }

    private static boolean hasUsableConstructor(TypeDescriptor type) {
        if (type.isRequiresEnclosingInstance()) {
            return false;
        }
        return type.getConstructors().stream().anyMatch(ConstructorDescriptor::isUsable);
    }

    private static Optional<TypeDescriptor> reject(TypeDescriptor type, String reason) {
        log.debug("Skipping {}: {}", type.getQualifiedName(), reason);
        return Optional.empty();
    }
}
