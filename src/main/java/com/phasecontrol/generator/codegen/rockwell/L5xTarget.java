package com.phasecontrol.generator.codegen.rockwell;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Names of the controller, program and routine an L5X export is addressed to.
 */
@Value
@Builder
public class L5xTarget {

    /**
     * Neutral placeholder, not the name of any real controller. Studio 5000 resolves
     * context elements by name on import, so exports meant for an existing project
     * should pass that project's controller name.
     */
    public static final String DEFAULT_CONTROLLER = "PhaseControl";
    public static final String DEFAULT_PROGRAM = "Phase01001_SEQ_DF_Master";
    public static final String DEFAULT_ROUTINE = "CM_Valve";

    @NonNull
    @Builder.Default
    String controllerName = DEFAULT_CONTROLLER;

    @NonNull
    @Builder.Default
    String programName = DEFAULT_PROGRAM;

    @NonNull
    @Builder.Default
    String routineName = DEFAULT_ROUTINE;

    public static L5xTarget defaults() {
        return L5xTarget.builder().build();
    }
}
