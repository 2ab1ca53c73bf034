package com.mediator.generator.cli;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.catalog.CatalogLoadException;
import com.mediator.generator.catalog.ClasspathTypeLookup;
import com.mediator.generator.catalog.SnapshotTypeCatalog;
import com.mediator.generator.catalog.source.JavaSourceCatalogLoader;
import com.mediator.generator.catalog.source.SourceFileDiscoveryService;
import com.mediator.generator.cli.exception.OptionsValidationException;
import com.mediator.generator.cli.model.GenerateOptions;
import com.mediator.generator.cli.model.ValidatedGenerateOptions;
import com.mediator.generator.cli.output.GenerateResultsPrinter;
import com.mediator.generator.cli.validation.GenerateOptionsValidator;
import com.mediator.generator.codegen.HandlerRegistrationGenerator;
import com.mediator.generator.codegen.model.GeneratedUnit;
import com.mediator.generator.codegen.model.GenerationResult;
import com.mediator.generator.codegen.model.core.context.GeneratorConfig;
import com.mediator.generator.codegen.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that scans source trees for request handlers and writes their
 * registration class.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "mediator-handler-generator 1.0.0",
        description = "Discovers request handler implementations in Java sources and generates their registration class."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        }
        printer.printBanner(options, validated);

        try (URLClassLoader libraries = new URLClassLoader(toUrls(validated.getClasspathEntries()),
                GenerateCommand.class.getClassLoader())) {
            GeneratorConfig config = toConfig(options);
            JavaSourceCatalogLoader loader = new JavaSourceCatalogLoader(new SourceFileDiscoveryService(),
                    new ClasspathTypeLookup(libraries));
            SnapshotTypeCatalog catalog = loader.load(validated.getSourceDirs());

            GenerationResult result = new HandlerRegistrationGenerator(config).generate(catalog);
            printer.printDiagnostics(result);

            Path writtenFile = writeOutput(validated.getNormalizedOutputDir(), config, result);
            printer.printSuccess(result, writtenFile);

            if (options.isFailOnWarning() && result.hasDiagnostics()) {
                printer.printFailOnWarning(result);
                return 1;
            }
            return 0;
        } catch (CatalogLoadException e) {
            log.error("Failed to load sources from {}", e.getPath(), e);
            return 1;
        } catch (IOException e) {
            log.error("Failed to write generated source", e);
            return 1;
        }
    }

    /**
     * Writes the unit under the output directory. When no unit was produced, a file
     * left by an earlier run is removed so the output always matches the sources.
     */
    private Path writeOutput(Path outputDir, GeneratorConfig config, GenerationResult result) throws IOException {
        if (result.getUnit().isPresent()) {
            GeneratedUnit unit = result.getUnit().get();
            Path file = outputDir.resolve(unit.getRelativePath());
            FileWriteUtil.safeWriteString(file, unit.getContent());
            return file;
        }
        Path stale = outputDir.resolve(config.getQualifiedClassName().replace('.', '/') + ".java");
        if (FileWriteUtil.deleteIfExists(stale)) {
            log.info("Removed stale output {}", stale);
        }
        return null;
    }

    static GeneratorConfig toConfig(GenerateOptions o) {
        return GeneratorConfig.builder()
                .contractName(o.getContract().trim())
                .targetPackage(o.getTargetPackage().trim())
                .className(o.getClassName().trim())
                .includeTimestamp(o.isIncludeTimestamp())
                .parallelResolution(o.isParallel())
                .build();
    }

    private static URL[] toUrls(List<Path> entries) {
        List<URL> urls = new ArrayList<>();
        for (Path entry : entries) {
            try {
                urls.add(entry.toAbsolutePath().toUri().toURL());
            } catch (MalformedURLException e) {
                throw new IllegalArgumentException("Invalid classpath entry: " + entry, e);
            }
        }
        return urls.toArray(new URL[0]);
    }
}
