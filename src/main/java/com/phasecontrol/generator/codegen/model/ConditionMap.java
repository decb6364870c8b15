package com.phasecontrol.generator.codegen.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Custom conditions keyed by step index, then by suffixed tag.
 */
public class ConditionMap {

    private static final ConditionMap EMPTY = new ConditionMap(Map.of());

    private final Map<Integer, Map<String, ConditionSpec>> byStep;

    private ConditionMap(Map<Integer, Map<String, ConditionSpec>> byStep) {
        this.byStep = byStep;
    }

    public static ConditionMap empty() {
        return EMPTY;
    }

    public static ConditionMap of(Map<Integer, Map<String, ConditionSpec>> byStep) {
        Map<Integer, Map<String, ConditionSpec>> copy = new HashMap<>();
        byStep.forEach((step, specs) -> copy.put(step, Map.copyOf(specs)));
        return new ConditionMap(Map.copyOf(copy));
    }

    public Optional<ConditionSpec> find(int stepIndex, String suffixedTag) {
        Map<String, ConditionSpec> specs = byStep.get(stepIndex);
        if (specs == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(specs.get(suffixedTag));
    }

    public boolean isEmpty() {
        return byStep.isEmpty();
    }

    public int size() {
        return byStep.values().stream().mapToInt(Map::size).sum();
    }
}
