package com.phasecontrol.generator.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Absolute, normalized paths produced by the validator.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    private Path normalizedOutputDir;
    private Path normalizedConfigFile;
}
