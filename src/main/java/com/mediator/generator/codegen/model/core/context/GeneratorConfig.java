package com.mediator.generator.codegen.model.core.context;

import java.time.Clock;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Configuration for the handler registration generator.
 *
 * The registry and handler-type names must match the contract: the generated
 * code passes {@code new <handlerTypeName><In, Out>() {}} and the handler class to
 * {@code <registryTypeName>.registerScoped}.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    public static final String DEFAULT_CONTRACT = "com.mediator.api.RequestHandler";
    public static final String DEFAULT_PACKAGE = "com.mediator.generated";
    public static final String DEFAULT_CLASS_NAME = "MediatorHandlerRegistrations";

    /**
     * Qualified name of the two-parameter handler contract.
     */
    @NonNull
    @Builder.Default
    String contractName = DEFAULT_CONTRACT;

    @NonNull
    @Builder.Default
    String registryTypeName = "com.mediator.api.HandlerRegistry";

    @NonNull
    @Builder.Default
    String handlerTypeTokenName = "com.mediator.api.HandlerType";

    /**
     * Package of the generated class; empty for the unnamed package.
     */
    @NonNull
    @Builder.Default
    String targetPackage = DEFAULT_PACKAGE;

    @NonNull
    @Builder.Default
    String className = DEFAULT_CLASS_NAME;

    @NonNull
    @Builder.Default
    String generatorName = "com.mediator.generator.HandlerRegistrationGenerator";

    @NonNull
    @Builder.Default
    String generatorVersion = "1.0.0";

    /**
     * Adds an informational generation-time line to the header. The output is then
     * no longer reproducible, so it stays off unless asked for.
     */
    boolean includeTimestamp;

    @NonNull
    @Builder.Default
    Clock clock = Clock.systemUTC();

    /**
     * Filter, resolve and match declared types on a parallel stream.
     */
    boolean parallelResolution;

    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public String getQualifiedClassName() {
        return targetPackage.isEmpty() ? className : targetPackage + "." + className;
    }

    public String getContractSimpleName() {
        return contractName.substring(contractName.lastIndexOf('.') + 1);
    }
}
