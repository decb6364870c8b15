package com.phasecontrol.generator.codegen.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Canonical compiled condition: disjuncts OR-ed together, each an AND-chain of
 * literals. Nesting is exactly one level deep.
 */
@Value
public class CompiledCondition {

    @NonNull
    List<List<LiteralRef>> disjuncts;

    public static CompiledCondition of(List<List<LiteralRef>> disjuncts) {
        return new CompiledCondition(disjuncts.stream().map(List::copyOf).toList());
    }

    public static CompiledCondition single(LiteralRef literal) {
        return new CompiledCondition(List.of(List.of(literal)));
    }

    public boolean isBranched() {
        return disjuncts.size() > 1;
    }
}
