package com.phasecontrol.generator.codegen;

import java.nio.file.Path;
import java.time.Clock;

import com.phasecontrol.generator.codegen.model.ControllerType;
import com.phasecontrol.generator.codegen.rockwell.L5xTarget;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one generation run.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path activationsFile;
    private Path conditionsFile;
    private Path configFile;
    private Path outputDir;

    @Builder.Default
    private ControllerType controllerType = ControllerType.ALL;

    /**
     * Restricts generation to one phase instance; null for every row in the source.
     */
    private Integer phaseInstanceId;

    @Builder.Default
    private String controllerName = L5xTarget.DEFAULT_CONTROLLER;
    @Builder.Default
    private String programName = L5xTarget.DEFAULT_PROGRAM;
    @Builder.Default
    private String routineName = L5xTarget.DEFAULT_ROUTINE;

    /**
     * Only compute the preview; write nothing.
     */
    private boolean previewOnly;

    /**
     * Source of every embedded timestamp.
     */
    @Builder.Default
    private Clock clock = Clock.systemDefaultZone();

    public L5xTarget getL5xTarget() {
        return L5xTarget.builder()
                .controllerName(controllerName)
                .programName(programName)
                .routineName(routineName)
                .build();
    }
}
