package com.phasecontrol.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A step and the tag-bearing activations that belong to it, in source order.
 */
@Value
@Builder
public class StepGroup {

    int stepIndex;

    @NonNull
    String stepName;

    @Singular
    List<Activation> activations;
}
