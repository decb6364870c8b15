package com.phasecontrol.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A custom precondition for one activation: an OR-of-AND expression over labels
 * ({@code X1}, {@code X2}, ...) and the literals those labels stand for.
 */
@Value
@Builder
public class ConditionSpec {

    @NonNull
    @Builder.Default
    String expression = "X1";

    @Singular
    List<ConditionLiteral> literals;
}
