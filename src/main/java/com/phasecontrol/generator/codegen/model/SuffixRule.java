package com.phasecontrol.generator.codegen.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of resolving an activation's device-class and qualifier codes: either the
 * activation is skipped, or it is emitted with a (possibly empty) tag suffix.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SuffixRule {

    private static final SuffixRule SKIP = new SuffixRule(true, null);

    boolean skip;

    /**
     * Tag suffix; null only when {@link #isSkip()}.
     */
    String suffix;

    public static SuffixRule skip() {
        return SKIP;
    }

    public static SuffixRule suffix(String suffix) {
        return new SuffixRule(false, suffix == null ? "" : suffix);
    }
}
