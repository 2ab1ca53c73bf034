package com.mediator.generator.processor;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Filer;
import javax.annotation.processing.Messager;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedOptions;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import javax.tools.JavaFileObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.catalog.model.SourceLocation;
import com.mediator.generator.codegen.HandlerRegistrationGenerator;
import com.mediator.generator.codegen.diagnostics.Diagnostic;
import com.mediator.generator.codegen.model.GeneratedUnit;
import com.mediator.generator.codegen.model.GenerationResult;
import com.mediator.generator.codegen.model.core.context.GeneratorConfig;

/**
 * Compiler host for the handler registration generator. Runs once, on the first
 * round that has root types, over every type of the compilation and writes the
 * registration class through the {@link Filer}. Generator diagnostics become
 * compiler warnings.
 *
 * <p>Processor options:
 * <ul>
 *   <li>{@code mediator.package} package of the generated class</li>
 *   <li>{@code mediator.className} simple name of the generated class</li>
 *   <li>{@code mediator.contract} qualified name of the handler contract</li>
 *   <li>{@code mediator.includeTimestamp} {@code true} to add the generation-time line</li>
 * </ul>
 */
@SupportedAnnotationTypes("*")
@SupportedOptions({
        HandlerRegistrationProcessor.OPTION_PACKAGE,
        HandlerRegistrationProcessor.OPTION_CLASS_NAME,
        HandlerRegistrationProcessor.OPTION_CONTRACT,
        HandlerRegistrationProcessor.OPTION_INCLUDE_TIMESTAMP
})
public class HandlerRegistrationProcessor extends AbstractProcessor {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistrationProcessor.class);

    public static final String OPTION_PACKAGE = "mediator.package";
    public static final String OPTION_CLASS_NAME = "mediator.className";
    public static final String OPTION_CONTRACT = "mediator.contract";
    public static final String OPTION_INCLUDE_TIMESTAMP = "mediator.includeTimestamp";

    private boolean generated;

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (generated || roundEnv.processingOver()) {
            return false;
        }
        List<TypeElement> rootTypes = new ArrayList<>(ElementFilter.typesIn(roundEnv.getRootElements()));
        if (rootTypes.isEmpty()) {
            return false;
        }
        generated = true;

        GeneratorConfig config = readConfig();
        ElementTypeCatalog catalog = new ElementTypeCatalog(processingEnv.getElementUtils(), rootTypes);
        GenerationResult result = new HandlerRegistrationGenerator(config).generate(catalog);

        Messager messager = processingEnv.getMessager();
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            Element element = elementFor(diagnostic.getLocation());
            String message = "[" + diagnostic.getId() + "] " + diagnostic.getMessage();
            if (element != null) {
                messager.printMessage(javax.tools.Diagnostic.Kind.WARNING, message, element);
            } else {
                messager.printMessage(javax.tools.Diagnostic.Kind.WARNING, message);
            }
        }

        result.getUnit().ifPresent(unit -> write(unit, rootTypes));
        // other processors may still want the annotations
        return false;
    }

    private GeneratorConfig readConfig() {
        GeneratorConfig.GeneratorConfigBuilder builder = GeneratorConfig.builder();
        String targetPackage = processingEnv.getOptions().get(OPTION_PACKAGE);
        if (targetPackage != null) {
            builder.targetPackage(targetPackage.trim());
        }
        String className = processingEnv.getOptions().get(OPTION_CLASS_NAME);
        if (className != null && !className.isBlank()) {
            builder.className(className.trim());
        }
        String contract = processingEnv.getOptions().get(OPTION_CONTRACT);
        if (contract != null && !contract.isBlank()) {
            builder.contractName(contract.trim());
        }
        builder.includeTimestamp(Boolean.parseBoolean(processingEnv.getOptions().get(OPTION_INCLUDE_TIMESTAMP)));
        return builder.build();
    }

    private Element elementFor(SourceLocation location) {
        if (location.getElementName() == null) {
            return null;
        }
        return processingEnv.getElementUtils().getTypeElement(location.getElementName());
    }

    private void write(GeneratedUnit unit, List<TypeElement> originatingTypes) {
        Filer filer = processingEnv.getFiler();
        try {
            JavaFileObject file = filer.createSourceFile(unit.getName(), originatingTypes.toArray(new Element[0]));
            try (Writer writer = file.openWriter()) {
                writer.write(unit.getContent());
            }
            log.debug("Wrote {}", unit.getName());
        } catch (IOException e) {
            processingEnv.getMessager().printMessage(javax.tools.Diagnostic.Kind.ERROR,
                    "Failed to write " + unit.getName() + ": " + e.getMessage());
        }
    }
}
