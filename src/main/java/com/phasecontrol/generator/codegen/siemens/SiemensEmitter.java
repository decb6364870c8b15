package com.phasecontrol.generator.codegen.siemens;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.phasecontrol.generator.codegen.grouping.StepGrouper;
import com.phasecontrol.generator.codegen.model.Activation;
import com.phasecontrol.generator.codegen.model.ConditionMap;
import com.phasecontrol.generator.codegen.model.ConditionSpec;
import com.phasecontrol.generator.codegen.model.ResolvedActivation;
import com.phasecontrol.generator.codegen.model.StepGroup;
import com.phasecontrol.generator.codegen.rule.ActivationRuleResolver;
import com.phasecontrol.generator.codegen.util.StepNaming;

/**
 * Generates Siemens SCL: one REGION per step whose body assigns every emitted
 * activation inside a single {@code IF <step flag> THEN ... RETURN; END_IF;} block.
 */
public class SiemensEmitter {

    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String INDENT = "    ";

    private final ActivationRuleResolver resolver;
    private final StepGrouper grouper;
    private final SclConditionRenderer conditionRenderer;
    private final Clock clock;

    public SiemensEmitter(ActivationRuleResolver resolver, StepGrouper grouper, Clock clock) {
        this.resolver = resolver;
        this.grouper = grouper;
        this.conditionRenderer = new SclConditionRenderer();
        this.clock = clock;
    }

    public String generateScl(List<Activation> activations, ConditionMap conditions) {
        List<String> lines = new ArrayList<>();
        lines.add("(* " + StepNaming.DOUBLE_RULE + " *)");
        lines.add("(* SCL Code Generated Automatically *)");
        lines.add("(* Date: " + LocalDateTime.now(clock).format(HEADER_DATE) + " *)");
        lines.add("(* " + StepNaming.DOUBLE_RULE + " *)");
        lines.add("");

        for (StepGroup step : grouper.group(activations)) {
            lines.add("REGION " + StepNaming.regionTitle(step.getStepIndex(), step.getStepName()));
            lines.add(INDENT + "IF " + StepNaming.siemensStepFlag(step.getStepIndex()) + " THEN");
            for (ResolvedActivation activation : resolver.emitted(step)) {
                ConditionSpec spec = conditions.find(step.getStepIndex(), activation.getSuffixedTag()).orElse(null);
                lines.add(INDENT + INDENT + quotedTag(activation) + " := " + conditionRenderer.render(spec) + ";");
            }
            lines.add(INDENT + INDENT + "RETURN;");
            lines.add(INDENT + "END_IF;");
            lines.add("END_REGION ;");
            lines.add("");
        }
        return String.join("\n", lines);
    }

    /**
     * {@code "XV101".activate}: only the tag itself is quoted, the suffix addresses a
     * member of it.
     */
    private static String quotedTag(ResolvedActivation activation) {
        return "\"" + activation.getActivation().getTag() + "\"" + activation.getSuffix();
    }
}
