package com.mediator.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    List<Path> sourceDirs;
    List<Path> classpathEntries;
    Path normalizedOutputDir;
}
