package com.phasecontrol.generator.codegen;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What a run would emit: steps with at least one emitted activation, each activation
 * with its resolved tag and the names of its device-class and qualifier codes.
 */
@Value
@Builder
public class GenerationPreview {

    @Singular
    List<StepPreview> steps;

    public int getTotalSteps() {
        return steps.size();
    }

    public int getTotalActivations() {
        return steps.stream().mapToInt(s -> s.getActivations().size()).sum();
    }

    @Value
    @Builder
    public static class StepPreview {
        int stepIndex;
        String stepName;
        @Singular
        List<ActivationPreview> activations;
    }

    @Value
    @Builder
    public static class ActivationPreview {
        String tag;
        String suffixedTag;
        int deviceClassCode;
        String deviceTypeName;
        int qualifierCode;
        String qualifierName;
    }
}
