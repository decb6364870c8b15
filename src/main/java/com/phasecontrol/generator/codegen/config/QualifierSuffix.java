package com.phasecontrol.generator.codegen.config;

import lombok.NonNull;
import lombok.Value;

/**
 * Two suffix variants: one for a specific qualifier code, one for every other code.
 *
 * Persisted as {@code {"pid_type_<n>": "...", "pid_type_other": "..."}}.
 */
@Value(staticConstructor = "of")
public class QualifierSuffix implements SuffixEntry {

    public static final String KEY_PREFIX = "pid_type_";
    public static final String OTHER_KEY = "pid_type_other";

    /**
     * Qualifier code the matching variant was declared for, null if none was declared.
     */
    Integer qualifierCode;

    @NonNull
    String matchingVariant;

    @NonNull
    String otherVariant;

    /**
     * Returns the variant declared for {@code qualifierCode}, or an empty suffix when
     * this entry declares a different code.
     */
    public String variantFor(int qualifierCode) {
        if (this.qualifierCode != null && this.qualifierCode == qualifierCode) {
            return matchingVariant;
        }
        return "";
    }

    public String getMatchingKey() {
        return qualifierCode == null ? null : KEY_PREFIX + qualifierCode;
    }
}
