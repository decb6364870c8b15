package com.phasecontrol.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Binds a DSL label such as {@code X1} to a tag, optionally negated.
 */
@Value
@Builder
public class ConditionLiteral {

    @NonNull
    String label;

    @NonNull
    String tag;

    boolean negated;
}
