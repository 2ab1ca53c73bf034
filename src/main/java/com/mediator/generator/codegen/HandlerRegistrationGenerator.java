package com.mediator.generator.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.catalog.TypeCatalog;
import com.mediator.generator.catalog.model.ContractInstantiation;
import com.mediator.generator.catalog.model.SourceLocation;
import com.mediator.generator.catalog.model.TypeDescriptor;
import com.mediator.generator.codegen.analysis.CandidateFilter;
import com.mediator.generator.codegen.analysis.EligibilityResolver;
import com.mediator.generator.codegen.analysis.InterfaceMatcher;
import com.mediator.generator.codegen.dedup.HandlerValidator;
import com.mediator.generator.codegen.diagnostics.DiagnosticReport;
import com.mediator.generator.codegen.diagnostics.GeneratorDiagnostics;
import com.mediator.generator.codegen.generator.HandlerSorter;
import com.mediator.generator.codegen.generator.RegistrationEmitter;
import com.mediator.generator.codegen.model.GeneratedUnit;
import com.mediator.generator.codegen.model.GenerationResult;
import com.mediator.generator.codegen.model.HandlerRecord;
import com.mediator.generator.codegen.model.core.context.CancellationSignal;
import com.mediator.generator.codegen.model.core.context.GenerationStats;
import com.mediator.generator.codegen.model.core.context.GeneratorConfig;

/**
 * Discovers the handlers in a type catalog and generates their registration class.
 *
 * <p>A run is a pure function of the catalog snapshot and the configuration:
 * <ol>
 *   <li>candidate filter, eligibility and contract matching per declared type
 *       (optionally in parallel; results keep catalog order)</li>
 *   <li>validation and duplicate detection in catalog order</li>
 *   <li>ordinal sort by handler name</li>
 *   <li>emission</li>
 * </ol>
 *
 * <p>Instances hold no per-run state and may be shared between threads. A
 * cancelled run throws {@link java.util.concurrent.CancellationException} and
 * produces neither output nor diagnostics.
 */
public class HandlerRegistrationGenerator {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistrationGenerator.class);

    private final GeneratorConfig config;
    private final CandidateFilter candidateFilter = new CandidateFilter();
    private final HandlerSorter sorter = new HandlerSorter();
    private final RegistrationEmitter emitter;

    public HandlerRegistrationGenerator(GeneratorConfig config) {
        this.config = config;
        this.emitter = new RegistrationEmitter(config);
    }

    public GenerationResult generate(TypeCatalog catalog) {
        return generate(catalog, CancellationSignal.NONE);
    }

    public GenerationResult generate(TypeCatalog catalog, CancellationSignal cancellation) {
        cancellation.throwIfCancellationRequested();
        DiagnosticReport report = new DiagnosticReport();
        List<TypeDescriptor> declaredTypes = catalog.getDeclaredTypes();

        if (catalog.findType(config.getContractName()).isEmpty()) {
            log.debug("Handler contract {} not found, no handlers will be registered", config.getContractName());
            report.report(GeneratorDiagnostics.MISSING_TARGET_CONTRACT.create(SourceLocation.NONE,
                    config.getContractName()));
            return GenerationResult.builder()
                    .diagnostics(report.getDiagnostics())
                    .stats(GenerationStats.builder().declaredTypes(declaredTypes.size()).build())
                    .build();
        }

        EligibilityResolver eligibilityResolver = new EligibilityResolver(catalog);
        InterfaceMatcher interfaceMatcher = new InterfaceMatcher(catalog, config.getContractName());

        Stream<TypeDescriptor> types = config.isParallelResolution()
                ? declaredTypes.parallelStream()
                : declaredTypes.stream();
        List<TypeOutcome> outcomes = types
                .map(type -> analyze(type, eligibilityResolver, interfaceMatcher, cancellation))
                .toList();

        HandlerValidator validator = new HandlerValidator(config.getContractSimpleName(), report);
        List<HandlerRecord> accepted = new ArrayList<>();
        int candidates = 0;
        int eligible = 0;
        int matches = 0;
        for (TypeOutcome outcome : outcomes) {
            candidates += outcome.candidate() ? 1 : 0;
            if (outcome.eligibleType() == null) {
                continue;
            }
            eligible++;
            for (ContractInstantiation instantiation : outcome.matches()) {
                matches++;
                validator.accept(outcome.eligibleType(), instantiation).ifPresent(accepted::add);
            }
        }

        cancellation.throwIfCancellationRequested();
        List<HandlerRecord> sorted = sorter.sort(accepted);
        Optional<GeneratedUnit> unit = emitter.emit(sorted);
        cancellation.throwIfCancellationRequested();

        GenerationStats stats = GenerationStats.builder()
                .declaredTypes(declaredTypes.size())
                .candidates(candidates)
                .eligibleTypes(eligible)
                .contractMatches(matches)
                .handlersRegistered(sorted.size())
                .build();
        log.debug("Declared types: {}, candidates: {}, eligible: {}, matches: {}, registered: {}",
                stats.getDeclaredTypes(), stats.getCandidates(), stats.getEligibleTypes(),
                stats.getContractMatches(), stats.getHandlersRegistered());

        return GenerationResult.builder()
                .unit(unit.orElse(null))
                .diagnostics(report.getDiagnostics())
                .handlers(sorted)
                .stats(stats)
                .build();
    }

    private TypeOutcome analyze(TypeDescriptor type, EligibilityResolver eligibilityResolver,
                                InterfaceMatcher interfaceMatcher, CancellationSignal cancellation) {
        cancellation.throwIfCancellationRequested();
        if (!candidateFilter.isCandidate(type)) {
            return new TypeOutcome(false, null, List.of());
        }
        Optional<TypeDescriptor> eligible = eligibilityResolver.resolve(type);
        if (eligible.isEmpty()) {
            return new TypeOutcome(true, null, List.of());
        }
        return new TypeOutcome(true, eligible.get(), interfaceMatcher.match(eligible.get()));
    }

    private record TypeOutcome(boolean candidate, TypeDescriptor eligibleType,
                               List<ContractInstantiation> matches) {
    }
}
