package com.phasecontrol.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phasecontrol.generator.cli.exception.OptionsValidationException;
import com.phasecontrol.generator.cli.model.GenerateOptions;
import com.phasecontrol.generator.cli.model.ValidatedGenerateOptions;
import com.phasecontrol.generator.cli.output.GenerateResultsPrinter;
import com.phasecontrol.generator.cli.validation.GenerateOptionsValidator;
import com.phasecontrol.generator.codegen.GeneratorConfig;
import com.phasecontrol.generator.codegen.GeneratorResult;
import com.phasecontrol.generator.codegen.PlcCodeGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating PLC step-activation code.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "phase-plc-generator 1.0.0",
        description = "Generates Rockwell ladder logic (text and L5X) and Siemens SCL from phase step activations."
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
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .activationsFile(options.getActivationsFile())
                .conditionsFile(options.getConditionsFile())
                .configFile(validated.getNormalizedConfigFile())
                .outputDir(validated.getNormalizedOutputDir())
                .controllerType(options.getControllerType())
                .phaseInstanceId(options.getPhaseInstanceId())
                .controllerName(options.getControllerName())
                .programName(options.getProgramName())
                .routineName(options.getRoutineName())
                .previewOnly(options.isPreview())
                .build();

        GeneratorResult result = new PlcCodeGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        if (options.isPreview()) {
            printer.printPreview(result);
        } else {
            printer.printSuccess(result);
        }
        return 0;
    }
}
