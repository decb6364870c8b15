package com.phasecontrol.generator.codegen.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phasecontrol.generator.codegen.config.ConfigTables;
import com.phasecontrol.generator.codegen.config.PlainSuffix;
import com.phasecontrol.generator.codegen.config.QualifierSuffix;
import com.phasecontrol.generator.codegen.config.SuffixEntry;
import com.phasecontrol.generator.codegen.model.Activation;
import com.phasecontrol.generator.codegen.model.ResolvedActivation;
import com.phasecontrol.generator.codegen.model.StepGroup;
import com.phasecontrol.generator.codegen.model.SuffixRule;

/**
 * Decides whether an activation is emitted and which suffix its tag receives.
 *
 * Skip rules, first match wins:
 * <ol>
 * <li>qualifier 3: always skipped</li>
 * <li>qualifier 4: skipped for device classes 0, 1, 2, 7, 10 and 14</li>
 * <li>qualifier 2: skipped unless device class is 14</li>
 * </ol>
 * Codes missing from the tables resolve to an empty suffix, never to an error.
 */
public class ActivationRuleResolver {
    private static final Logger log = LoggerFactory.getLogger(ActivationRuleResolver.class);

    public static final int PID_DEVICE_CLASS = 8;
    public static final int TOTALIZER_DEVICE_CLASS = 14;

    private static final int QUALIFIER_SETPOINT = 3;
    private static final int QUALIFIER_FIXED_OUTPUT = 4;
    private static final int QUALIFIER_RESET = 2;

    private static final Set<Integer> FIXED_OUTPUT_SKIPPED_CLASSES = Set.of(0, 1, 2, 7, 10, 14);

    private final ConfigTables tables;

    public ActivationRuleResolver(ConfigTables tables) {
        this.tables = tables;
    }

    public SuffixRule resolve(int deviceClassCode, int qualifierCode) {
        if (isSkipped(deviceClassCode, qualifierCode)) {
            return SuffixRule.skip();
        }
        return SuffixRule.suffix(lookupSuffix(deviceClassCode, qualifierCode));
    }

    public SuffixRule resolve(Activation activation) {
        return resolve(activation.getDeviceClassCode(), activation.getQualifierCode());
    }

    /**
     * The activations of {@code group} that survive the skip rules, in group order.
     * Every emitter and every line count goes through this method.
     */
    public List<ResolvedActivation> emitted(StepGroup group) {
        List<ResolvedActivation> result = new ArrayList<>();
        for (Activation activation : group.getActivations()) {
            SuffixRule rule = resolve(activation);
            if (rule.isSkip()) {
                log.debug("Skipping {} in step {} (device class {}, qualifier {})", activation.getTag(),
                        group.getStepIndex(), activation.getDeviceClassCode(), activation.getQualifierCode());
                continue;
            }
            result.add(new ResolvedActivation(activation, rule.getSuffix()));
        }
        return result;
    }

    private static boolean isSkipped(int deviceClassCode, int qualifierCode) {
        if (qualifierCode == QUALIFIER_SETPOINT) {
            return true;
        }
        if (qualifierCode == QUALIFIER_FIXED_OUTPUT && FIXED_OUTPUT_SKIPPED_CLASSES.contains(deviceClassCode)) {
            return true;
        }
        return qualifierCode == QUALIFIER_RESET && deviceClassCode != TOTALIZER_DEVICE_CLASS;
    }

    private String lookupSuffix(int deviceClassCode, int qualifierCode) {
        SuffixEntry entry = tables.findSuffixRule(deviceClassCode).orElse(null);
        if (entry == null) {
            return "";
        }
        if (entry instanceof PlainSuffix plain) {
            return plain.getText();
        }
        if (entry instanceof QualifierSuffix variants) {
            return switch (deviceClassCode) {
                case PID_DEVICE_CLASS -> qualifierCode == QUALIFIER_FIXED_OUTPUT
                        ? variants.variantFor(QUALIFIER_FIXED_OUTPUT)
                        : variants.getOtherVariant();
                case TOTALIZER_DEVICE_CLASS -> qualifierCode == QUALIFIER_RESET
                        ? variants.variantFor(QUALIFIER_RESET)
                        : variants.getOtherVariant();
                default -> variants.getOtherVariant();
            };
        }
        return "";
    }
}
