package com.phasecontrol.generator.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.phasecontrol.generator.codegen.model.Activation;
import com.phasecontrol.generator.codegen.model.ConditionLiteral;
import com.phasecontrol.generator.codegen.model.ConditionMap;
import com.phasecontrol.generator.codegen.model.ConditionSpec;

/**
 * Shared fixture: an idle step without activations and a fill step with a custom
 * condition, a skipped setpoint row and a fixed-output PID row.
 */
public final class TestActivations {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    private TestActivations() {
    }

    public static Activation row(int step, String name, int deviceClass, int qualifier, String tag) {
        return Activation.builder()
                .stepIndex(step)
                .stepName(name)
                .deviceClassCode(deviceClass)
                .qualifierCode(qualifier)
                .tag(tag)
                .build();
    }

    public static List<Activation> fillSequence() {
        return List.of(
                row(2, "Fill", 0, 0, "XV101"),
                row(1, "Idle", 0, 0, null),
                row(2, "Fill", 0, 3, "XV102"),
                row(2, "Fill", 8, 4, "FIC100"));
    }

    public static ConditionMap fillConditions() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("X1 OR X2")
                .literal(ConditionLiteral.builder().label("X1").tag("LS1").build())
                .literal(ConditionLiteral.builder().label("X2").tag("LS2").negated(true).build())
                .build();
        return ConditionMap.of(Map.of(2, Map.of("XV101.activate", spec)));
    }
}
