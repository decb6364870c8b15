package com.phasecontrol.generator.codegen.rockwell;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phasecontrol.generator.codegen.condition.ConditionCompiler;
import com.phasecontrol.generator.codegen.grouping.StepGrouper;
import com.phasecontrol.generator.codegen.model.Activation;
import com.phasecontrol.generator.codegen.model.CompiledCondition;
import com.phasecontrol.generator.codegen.model.ConditionMap;
import com.phasecontrol.generator.codegen.model.ResolvedActivation;
import com.phasecontrol.generator.codegen.model.StepGroup;
import com.phasecontrol.generator.codegen.rule.ActivationRuleResolver;
import com.phasecontrol.generator.codegen.template.TemplateRenderer;
import com.phasecontrol.generator.codegen.util.StepNaming;

/**
 * Generates Rockwell ladder logic: a plain mnemonic listing and a Studio 5000 L5X
 * rung export. Each emitted activation latches its suffixed tag ({@code OTL}) while
 * its condition holds; the default condition is the step's own flag.
 */
public class RockwellEmitter {
    private static final Logger log = LoggerFactory.getLogger(RockwellEmitter.class);

    static final String L5X_TEMPLATE = "rockwell/l5x-rung-export.ftl";

    /**
     * Rung numbers 0 and 1 belong to the export preamble.
     */
    public static final int FIRST_RUNG_NUMBER = 2;
    public static final int STEP_FLAG_ARRAY_SIZE = 128;

    private static final DateTimeFormatter TEXT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter EXPORT_DATE = DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss yyyy",
            Locale.US);

    private final ActivationRuleResolver resolver;
    private final ConditionCompiler compiler;
    private final StepGrouper grouper;
    private final LadderConditionRenderer conditionRenderer;
    private final TemplateRenderer templateRenderer;
    private final Clock clock;

    public RockwellEmitter(ActivationRuleResolver resolver, ConditionCompiler compiler, StepGrouper grouper,
            TemplateRenderer templateRenderer, Clock clock) {
        this.resolver = resolver;
        this.compiler = compiler;
        this.grouper = grouper;
        this.conditionRenderer = new LadderConditionRenderer();
        this.templateRenderer = templateRenderer;
        this.clock = clock;
    }

    /**
     * Plain-text ladder listing: a banner, then one section per step with one
     * {@code <condition> OTL <tag>} line per emitted activation.
     */
    public String generateText(List<Activation> activations, ConditionMap conditions) {
        List<String> lines = new ArrayList<>();
        lines.add(StepNaming.DOUBLE_RULE);
        lines.add("Ladder Logic Generated Automatically");
        lines.add("Date: " + LocalDateTime.now(clock).format(TEXT_DATE));
        lines.add(StepNaming.DOUBLE_RULE);
        lines.add("");

        for (StepGroup step : grouper.group(activations)) {
            lines.add(StepNaming.RULE);
            lines.add(StepNaming.ladderTitle(step.getStepIndex(), step.getStepName()));
            lines.add(StepNaming.RULE);
            for (ResolvedActivation activation : resolver.emitted(step)) {
                CompiledCondition condition = conditionFor(step, activation, conditions);
                lines.add(conditionRenderer.toMnemonic(condition) + " OTL " + activation.getSuffixedTag());
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }

    /**
     * Full L5X rung export: the step-flag data type, the 128-element step-flag tag
     * with one comment per step, and a routine with a {@code NOP()} banner rung per
     * step followed by its activation rungs.
     */
    public String generateL5x(List<Activation> activations, ConditionMap conditions, L5xTarget target) {
        List<StepGroup> steps = grouper.group(activations);
        int targetCount = countRungs(steps);

        List<L5xDocument.StepComment> comments = new ArrayList<>();
        List<L5xDocument.Rung> rungs = new ArrayList<>();
        int rungNumber = FIRST_RUNG_NUMBER;
        for (StepGroup step : steps) {
            comments.add(new L5xDocument.StepComment(step.getStepIndex(), step.getStepName()));
            rungs.add(new L5xDocument.Rung(rungNumber++, stepBanner(step), "NOP();"));
            for (ResolvedActivation activation : resolver.emitted(step)) {
                CompiledCondition condition = conditionFor(step, activation, conditions);
                String text = conditionRenderer.toRungText(condition) + "OTL(" + activation.getSuffixedTag() + ");";
                rungs.add(new L5xDocument.Rung(rungNumber++, null, text));
            }
        }
        log.debug("Rendered {} rungs for {} steps (TargetCount={})", rungs.size(), steps.size(), targetCount);

        L5xDocument document = L5xDocument.builder()
                .targetCount(targetCount)
                .exportDate(LocalDateTime.now(clock).format(EXPORT_DATE))
                .controllerName(target.getControllerName())
                .programName(target.getProgramName())
                .routineName(target.getRoutineName())
                .stepComments(comments)
                .l5kData(l5kStepFlagData())
                .elements(stepFlagElements())
                .rungs(rungs)
                .build();
        return templateRenderer.render(L5X_TEMPLATE, Map.of("doc", document));
    }

    /**
     * One banner rung per step plus one rung per activation that survives the skip
     * rules.
     */
    public int countRungs(List<StepGroup> steps) {
        int count = 0;
        for (StepGroup step : steps) {
            count += 1 + resolver.emitted(step).size();
        }
        return count;
    }

    private CompiledCondition conditionFor(StepGroup step, ResolvedActivation activation, ConditionMap conditions) {
        return compiler.compile(conditions.find(step.getStepIndex(), activation.getSuffixedTag()).orElse(null),
                StepNaming.rockwellStepFlag(step.getStepIndex()));
    }

    private static String stepBanner(StepGroup step) {
        return StepNaming.RULE + "\n" + StepNaming.ladderTitle(step.getStepIndex(), step.getStepName()) + "\n"
                + StepNaming.RULE;
    }

    // Element 0 is the idle step and starts active; bit values are Flag=1, FlagLE=2, FlagGE=4.
    private static String l5kStepFlagData() {
        List<String> values = new ArrayList<>(Collections.nCopies(STEP_FLAG_ARRAY_SIZE, "[2]"));
        values.set(0, "[7]");
        return String.join(",", values);
    }

    private static List<L5xDocument.StepFlagElement> stepFlagElements() {
        List<L5xDocument.StepFlagElement> elements = new ArrayList<>(STEP_FLAG_ARRAY_SIZE);
        for (int i = 0; i < STEP_FLAG_ARRAY_SIZE; i++) {
            String active = i == 0 ? "1" : "0";
            elements.add(new L5xDocument.StepFlagElement(i, active, "1", active));
        }
        return elements;
    }
}
