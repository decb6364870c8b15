package com.phasecontrol.generator.codegen.config;

import lombok.NonNull;
import lombok.Value;

/**
 * A suffix used verbatim regardless of qualifier.
 */
@Value(staticConstructor = "of")
public class PlainSuffix implements SuffixEntry {

    @NonNull
    String text;
}
