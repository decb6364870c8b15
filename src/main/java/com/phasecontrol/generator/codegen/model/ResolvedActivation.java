package com.phasecontrol.generator.codegen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * An activation that survived the skip rules, with its suffix applied.
 */
@Value
public class ResolvedActivation {

    @NonNull
    Activation activation;

    @NonNull
    String suffix;

    /**
     * Tag plus suffix, e.g. {@code XV101.activate}. This is the key custom conditions
     * are registered under.
     */
    public String getSuffixedTag() {
        return activation.getTag() + suffix;
    }
}
