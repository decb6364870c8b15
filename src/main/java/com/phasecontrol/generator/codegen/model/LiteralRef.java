package com.phasecontrol.generator.codegen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A tag reference inside a compiled clause.
 */
@Value(staticConstructor = "of")
public class LiteralRef {

    @NonNull
    String tag;

    boolean negated;
}
