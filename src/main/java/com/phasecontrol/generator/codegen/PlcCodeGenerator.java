package com.phasecontrol.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phasecontrol.generator.codegen.condition.ConditionCompiler;
import com.phasecontrol.generator.codegen.config.ConfigTables;
import com.phasecontrol.generator.codegen.config.ConfigTablesStore;
import com.phasecontrol.generator.codegen.grouping.StepGrouper;
import com.phasecontrol.generator.codegen.input.ActivationSource;
import com.phasecontrol.generator.codegen.input.ConditionMapReader;
import com.phasecontrol.generator.codegen.input.JsonActivationSource;
import com.phasecontrol.generator.codegen.model.Activation;
import com.phasecontrol.generator.codegen.model.ConditionMap;
import com.phasecontrol.generator.codegen.model.ResolvedActivation;
import com.phasecontrol.generator.codegen.model.StepGroup;
import com.phasecontrol.generator.codegen.rockwell.RockwellEmitter;
import com.phasecontrol.generator.codegen.rule.ActivationRuleResolver;
import com.phasecontrol.generator.codegen.siemens.SiemensEmitter;
import com.phasecontrol.generator.codegen.template.TemplateRenderer;
import com.phasecontrol.generator.codegen.util.FileWriteUtil;

/**
 * Main generator: loads the mapping tables, activations and custom conditions, then
 * writes the ladder listing, the L5X export and the SCL listing for the selected
 * controller type.
 */
public class PlcCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PlcCodeGenerator.class);

    public static final String LADDER_TEXT_FILE = "rockwell_ladder.txt";
    public static final String L5X_FILE = "rockwell_ladder.L5X";
    public static final String SCL_FILE = "siemens_scl.scl";

    private final GeneratorConfig config;
    private final ActivationSource activationSource;
    private final ConfigTablesStore configStore;
    private final ConditionMapReader conditionReader;
    private final StepGrouper grouper;

    public PlcCodeGenerator(GeneratorConfig config) {
        this(config, new JsonActivationSource(config.getActivationsFile()));
    }

    public PlcCodeGenerator(GeneratorConfig config, ActivationSource activationSource) {
        this.config = config;
        this.activationSource = activationSource;
        this.configStore = new ConfigTablesStore();
        this.conditionReader = new ConditionMapReader();
        this.grouper = new StepGrouper();
    }

    /**
     * Run the whole generation.
     */
    public GeneratorResult generate() {
        try {
            log.info("Starting PLC code generation...");

            // Step 1: Mapping tables
            log.info("Step 1: Loading mapping tables...");
            ConfigTables tables = config.getConfigFile() != null
                    ? configStore.loadOrCreate(config.getConfigFile())
                    : ConfigTables.defaults();
            ActivationRuleResolver resolver = new ActivationRuleResolver(tables);

            // Step 2: Activations
            log.info("Step 2: Fetching activations...");
            List<Activation> activations = activationSource.fetchActivations(config.getPhaseInstanceId());
            if (activations.isEmpty()) {
                return GeneratorResult.failure("No activations found");
            }

            // Step 3: Custom conditions
            log.info("Step 3: Reading custom conditions...");
            ConditionMap conditions = config.getConditionsFile() != null
                    ? conditionReader.read(config.getConditionsFile())
                    : ConditionMap.empty();
            log.info("{} custom conditions loaded", conditions.size());

            List<StepGroup> steps = grouper.group(activations);
            GenerationPreview preview = buildPreview(steps, resolver, tables);
            int tagged = (int) activations.stream().filter(Activation::hasActivation).count();

            GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                    .success(true)
                    .activationRows(activations.size())
                    .stepCount(steps.size())
                    .emittedActivations(preview.getTotalActivations())
                    .skippedActivations(tagged - preview.getTotalActivations())
                    .preview(preview);

            if (config.isPreviewOnly()) {
                log.info("Preview only, no files written");
                return result.build();
            }

            // Step 4: Output directory
            log.info("Step 4: Creating output directory...");
            Path outputDir = config.getOutputDir() != null ? config.getOutputDir() : Path.of("output");
            FileWriteUtil.createDirectories(outputDir);
            result.outputPath(outputDir.toAbsolutePath());

            // Step 5: Emit
            ConditionCompiler compiler = new ConditionCompiler();
            if (config.getControllerType().includesRockwell()) {
                log.info("Step 5: Generating Rockwell ladder (text and L5X)...");
                RockwellEmitter rockwell = new RockwellEmitter(resolver, compiler, grouper, new TemplateRenderer(),
                        config.getClock());
                result.filesGenerated(List.of(
                        write(outputDir.resolve(LADDER_TEXT_FILE), rockwell.generateText(activations, conditions)),
                        write(outputDir.resolve(L5X_FILE),
                                rockwell.generateL5x(activations, conditions, config.getL5xTarget()))));
                result.rungCount(rockwell.countRungs(steps));
            }
            if (config.getControllerType().includesSiemens()) {
                log.info("Step 5: Generating Siemens SCL...");
                SiemensEmitter siemens = new SiemensEmitter(resolver, grouper, config.getClock());
                result.fileGenerated(write(outputDir.resolve(SCL_FILE), siemens.generateScl(activations, conditions)));
            }

            log.info("PLC code generation complete!");
            return result.build();

        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private static Path write(Path file, String content) throws IOException {
        FileWriteUtil.safeWriteString(file, content);
        log.info("Saved {}", file);
        return file;
    }

    private static GenerationPreview buildPreview(List<StepGroup> steps, ActivationRuleResolver resolver,
            ConfigTables tables) {
        GenerationPreview.GenerationPreviewBuilder preview = GenerationPreview.builder();
        for (StepGroup step : steps) {
            List<ResolvedActivation> emitted = resolver.emitted(step);
            if (emitted.isEmpty()) {
                continue;
            }
            GenerationPreview.StepPreview.StepPreviewBuilder stepPreview = GenerationPreview.StepPreview.builder()
                    .stepIndex(step.getStepIndex())
                    .stepName(step.getStepName());
            for (ResolvedActivation resolved : emitted) {
                Activation activation = resolved.getActivation();
                stepPreview.activation(GenerationPreview.ActivationPreview.builder()
                        .tag(activation.getTag())
                        .suffixedTag(resolved.getSuffixedTag())
                        .deviceClassCode(activation.getDeviceClassCode())
                        .deviceTypeName(tables.deviceTypeName(activation.getDeviceClassCode()))
                        .qualifierCode(activation.getQualifierCode())
                        .qualifierName(tables.qualifierName(activation.getQualifierCode()))
                        .build());
            }
            preview.step(stepPreview.build());
        }
        return preview.build();
    }
}
