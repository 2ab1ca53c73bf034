package com.mediator.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mediator.generator.codegen.model.core.context.GeneratorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--source-dir", "-s" }, required = true,
			description = "Source root to scan for handlers (repeatable)")
	private List<Path> sourceDirs = new ArrayList<>();

	@Option(names = { "--classpath", "-cp" },
			description = "Jars and class directories used to resolve library supertypes and the handler contract, separated by the platform path separator")
	private String classpath;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "target/generated-sources/mediator",
			description = "Root directory for the generated source (default: ${DEFAULT-VALUE})")
	private Path outputDir;

	@Option(names = { "--package", "-p" }, defaultValue = GeneratorConfig.DEFAULT_PACKAGE,
			description = "Package of the generated class (default: ${DEFAULT-VALUE})")
	private String targetPackage;

	@Option(names = { "--class-name" }, defaultValue = GeneratorConfig.DEFAULT_CLASS_NAME,
			description = "Simple name of the generated class (default: ${DEFAULT-VALUE})")
	private String className;

	@Option(names = { "--contract" }, defaultValue = GeneratorConfig.DEFAULT_CONTRACT,
			description = "Qualified name of the two-parameter handler contract (default: ${DEFAULT-VALUE})")
	private String contract;

	@Option(names = { "--include-timestamp" },
			description = "Add an informational generation-time line to the header (output is no longer reproducible)")
	private boolean includeTimestamp;

	@Option(names = { "--parallel" }, description = "Resolve and match declared types in parallel")
	private boolean parallel;

	@Option(names = { "--fail-on-warning" }, description = "Exit with status 1 when any diagnostic is reported")
	private boolean failOnWarning;

}
