package com.mediator.generator.codegen.dedup;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.catalog.model.BaseTypeClause;
import com.mediator.generator.catalog.model.ContractInstantiation;
import com.mediator.generator.catalog.model.SourceLocation;
import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.catalog.model.TypeReference;
import com.mediator.generator.codegen.diagnostics.DiagnosticReport;
import com.mediator.generator.codegen.diagnostics.GeneratorDiagnostics;
import com.mediator.generator.codegen.model.HandlerRecord;
import com.mediator.generator.codegen.model.HandlerSignature;

/**
 * Turns contract matches into handler records for one run.
 *
 * A match without exactly two type arguments is reported and dropped. A match whose
 * (input, output) pair was already accepted is reported but still accepted: which of
 * the registrations wins is the container's decision.
 */
public class HandlerValidator {

    private static final Logger log = LoggerFactory.getLogger(HandlerValidator.class);

    private final String contractSimpleName;
    private final DiagnosticReport report;
    private final Set<HandlerSignature> seenSignatures = new HashSet<>();

    public HandlerValidator(String contractSimpleName, DiagnosticReport report) {
        this.contractSimpleName = contractSimpleName;
        this.report = report;
    }

    public Optional<HandlerRecord> accept(TypeDescriptor handler, ContractInstantiation instantiation) {
        if (instantiation.getArity() != 2) {
            report.report(GeneratorDiagnostics.ARITY_MISMATCH.create(
                    bestLocation(handler, instantiation),
                    handler.getSimpleName(),
                    contractSimpleName,
                    instantiation.getArity()));
            return Optional.empty();
        }

        TypeReference inputType = instantiation.getTypeArguments().get(0);
        TypeReference outputType = instantiation.getTypeArguments().get(1);
        HandlerRecord record = new HandlerRecord(handler, inputType, outputType);

        if (!seenSignatures.add(record.getSignature())) {
            log.debug("Duplicate signature {} on {}", record.getSignature(), handler.getQualifiedName());
            report.report(GeneratorDiagnostics.DUPLICATE_HANDLER.create(
                    bestLocation(handler, instantiation),
                    inputType.getSimpleName(),
                    outputType.getSimpleName(),
                    handler.getSimpleName()));
        }
        return Optional.of(record);
    }

    /**
     * The base-list clause the contract was reached through, else the first
     * base-list clause, else the declaration itself.
     */
    static SourceLocation bestLocation(TypeDescriptor handler, ContractInstantiation instantiation) {
        BaseTypeClause via = instantiation.getVia();
        if (via != null && via.getLocation().isKnown()) {
            return via.getLocation();
        }
        return handler.getBaseTypes().stream()
                .map(BaseTypeClause::getLocation)
                .filter(SourceLocation::isKnown)
                .findFirst()
                .orElse(handler.getLocation());
    }
}
