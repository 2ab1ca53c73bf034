package com.mediator.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediator.generator.cli.exception.OptionsValidationException;
import com.mediator.generator.cli.model.GenerateOptions;
import com.mediator.generator.cli.model.ValidatedGenerateOptions;
import com.mediator.generator.codegen.diagnostics.Diagnostic;
import com.mediator.generator.codegen.model.GenerationResult;
import com.mediator.generator.codegen.model.HandlerRecord;
import com.mediator.generator.codegen.model.core.context.GenerationStats;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Mediator Handler Registration Generator");
        log.info("=================================================");
        for (Path dir : v.getSourceDirs()) {
            log.info("Source Directory: {}", dir);
        }
        log.info("Classpath Entries: {}", v.getClasspathEntries().isEmpty() ? "None" : v.getClasspathEntries().size());
        log.info("Contract: {}", o.getContract());
        log.info("Generated Class: {}{}", o.getTargetPackage().isBlank() ? "" : o.getTargetPackage().trim() + ".",
                o.getClassName().trim());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printDiagnostics(GenerationResult result) {
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            log.warn(diagnostic.format());
        }
    }

    /**
     * @param writtenFile the generated file, or {@code null} when nothing was written
     */
    public void printSuccess(GenerationResult result, Path writtenFile) {
        GenerationStats stats = result.getStats();

        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Declared Types Scanned: {}", stats.getDeclaredTypes());
        log.info("Candidates: {}", stats.getCandidates());
        log.info("Eligible Types: {}", stats.getEligibleTypes());
        log.info("Contract Implementations: {}", stats.getContractMatches());
        log.info("Handlers Registered: {}", stats.getHandlersRegistered());
        log.info("Diagnostics: {}", result.getDiagnostics().size());

        if (!result.getHandlers().isEmpty()) {
            log.info("");
            log.info("Registrations:");
            for (HandlerRecord handler : result.getHandlers()) {
                log.info("  {} -> {} : {}", handler.getInputType(), handler.getOutputType(), handler.getHandlerName());
            }
        }

        log.info("");
        if (writtenFile != null) {
            log.info("Output File: {}", writtenFile);
        } else {
            log.info("No handlers discovered, no file written.");
        }
        log.info("=================================================");
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        for (String error : e.getErrors()) {
            log.error("  - {}", error);
        }
    }

    public void printFailOnWarning(GenerationResult result) {
        log.error("Generation reported {} diagnostic(s) and --fail-on-warning is set", result.getDiagnostics().size());
    }
}
