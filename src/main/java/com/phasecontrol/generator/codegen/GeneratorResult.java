package com.phasecontrol.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    @Singular("fileGenerated")
    private List<Path> filesGenerated;

    private int activationRows;
    private int stepCount;
    private int emittedActivations;
    private int skippedActivations;
    private int rungCount;

    private GenerationPreview preview;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
