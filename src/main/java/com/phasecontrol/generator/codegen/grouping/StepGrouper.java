package com.phasecontrol.generator.codegen.grouping;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.phasecontrol.generator.codegen.model.Activation;
import com.phasecontrol.generator.codegen.model.StepGroup;

/**
 * Partitions a flat activation sequence into steps.
 *
 * Steps come out in ascending index order whatever the input order. Within a step,
 * tag-bearing activations keep their input order; placeholder rows only make the
 * step known. The first row seen for a step names it.
 */
public class StepGrouper {

    public List<StepGroup> group(List<Activation> activations) {
        Map<Integer, StepGroup.StepGroupBuilder> steps = new TreeMap<>();
        for (Activation activation : activations) {
            StepGroup.StepGroupBuilder step = steps.computeIfAbsent(activation.getStepIndex(),
                    index -> StepGroup.builder().stepIndex(index).stepName(activation.getStepName()));
            if (activation.hasActivation()) {
                step.activation(activation);
            }
        }
        return steps.values().stream().map(StepGroup.StepGroupBuilder::build).toList();
    }
}
