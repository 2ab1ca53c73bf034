package com.mediator.generator.cli.validation;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.lang.model.SourceVersion;

import com.mediator.generator.cli.exception.OptionsValidationException;
import com.mediator.generator.cli.model.GenerateOptions;
import com.mediator.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> sourceDirs = o.getSourceDirs() == null ? List.of() : o.getSourceDirs();
		if (sourceDirs.isEmpty()) {
			errors.add("At least one source directory is required (--source-dir / -s).");
		}
		List<Path> normalizedSourceDirs = new ArrayList<>();
		for (Path dir : sourceDirs) {
			if (!existsDirectory(dir)) {
				errors.add("Source directory does not exist or is not a directory: " + dir);
			} else {
				normalizedSourceDirs.add(dir.toAbsolutePath().normalize());
			}
		}

		List<Path> classpathEntries = parseClasspath(o.getClasspath(), errors);

		String targetPackage = o.getTargetPackage() == null ? "" : o.getTargetPackage().trim();
		if (!targetPackage.isEmpty() && !SourceVersion.isName(targetPackage)) {
			errors.add("Package is not a valid Java package name: " + targetPackage);
		}

		if (isBlank(o.getClassName())) {
			errors.add("Class name must not be blank (--class-name).");
		} else if (!SourceVersion.isIdentifier(o.getClassName().trim()) || SourceVersion.isKeyword(o.getClassName().trim())) {
			errors.add("Class name is not a valid Java identifier: " + o.getClassName());
		}

		if (isBlank(o.getContract()) || !SourceVersion.isName(o.getContract().trim())) {
			errors.add("Contract must be a qualified Java type name (--contract). Got: " + o.getContract());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(List.copyOf(normalizedSourceDirs), classpathEntries, normalizedOutputDir);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<Path> parseClasspath(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}

		List<Path> result = Arrays.stream(raw.split(File.pathSeparator)).map(String::trim).filter(s -> !s.isEmpty())
				.map(Path::of).toList();

		for (Path p : result) {
			if (!Files.exists(p)) {
				errors.add("Classpath entry does not exist: " + p);
			}
		}

		return result;
	}
}
