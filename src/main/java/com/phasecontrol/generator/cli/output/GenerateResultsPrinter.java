package com.phasecontrol.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phasecontrol.generator.cli.model.GenerateOptions;
import com.phasecontrol.generator.cli.model.ValidatedGenerateOptions;
import com.phasecontrol.generator.codegen.GenerationPreview;
import com.phasecontrol.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Phase PLC Generator");
        log.info("Rockwell Studio 5000 | Siemens TIA Portal");
        log.info("=================================================");
        log.info("Activations: {}", o.getActivationsFile().toAbsolutePath());
        log.info("Conditions: {}", o.getConditionsFile() != null ? o.getConditionsFile().toAbsolutePath() : "None");
        log.info("Config: {}", v.getNormalizedConfigFile() != null ? v.getNormalizedConfigFile() : "Built-in defaults");
        log.info("Controller: {}", o.getControllerType());
        log.info("Phase Instance: {}", o.getPhaseInstanceId() != null ? o.getPhaseInstanceId() : "All");
        if (o.getControllerType().includesRockwell()) {
            log.info("L5X Target: {} / {} / {}", o.getControllerName(), o.getProgramName(), o.getRoutineName());
        }
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        for (Path file : result.getFilesGenerated()) {
            log.info("  {}", file.getFileName());
        }
        printCounts(result);
        log.info("=================================================");
    }

    public void printPreview(GeneratorResult result) {
        GenerationPreview preview = result.getPreview();
        log.info("");
        log.info("=================================================");
        log.info("PREVIEW");
        log.info("=================================================");
        for (GenerationPreview.StepPreview step : preview.getSteps()) {
            log.info("Step {} -- {}", String.format("%02d", step.getStepIndex()), step.getStepName());
            for (GenerationPreview.ActivationPreview a : step.getActivations()) {
                log.info("  {} ({} {}, {} {})", a.getSuffixedTag(), a.getDeviceClassCode(), a.getDeviceTypeName(),
                        a.getQualifierCode(), a.getQualifierName());
            }
        }
        log.info("");
        log.info("Steps with activations: {}", preview.getTotalSteps());
        log.info("Activations: {}", preview.getTotalActivations());
        printCounts(result);
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }

    private void printCounts(GeneratorResult result) {
        log.info("");
        log.info("Activation rows read: {}", result.getActivationRows());
        log.info("Steps: {}", result.getStepCount());
        log.info("Activations emitted: {}", result.getEmittedActivations());
        log.info("Activations skipped: {}", result.getSkippedActivations());
        if (result.getRungCount() > 0) {
            log.info("L5X rungs: {}", result.getRungCount());
        }
    }
}
