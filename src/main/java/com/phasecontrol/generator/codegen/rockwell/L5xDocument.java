package com.phasecontrol.generator.codegen.rockwell;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Data model handed to the L5X rung-export template.
 */
@Value
@Builder
public class L5xDocument {

    int targetCount;

    @NonNull
    String exportDate;

    @NonNull
    String controllerName;

    @NonNull
    String programName;

    @NonNull
    String routineName;

    @NonNull
    List<StepComment> stepComments;

    /**
     * L5K encoding of the step-flag array, e.g. {@code [7],[2],[2],...}.
     */
    @NonNull
    String l5kData;

    @NonNull
    List<StepFlagElement> elements;

    @NonNull
    List<Rung> rungs;

    @Value
    public static class StepComment {
        int index;
        String name;
    }

    @Value
    public static class StepFlagElement {
        int index;
        String flag;
        String flagLe;
        String flagGe;
    }

    @Value
    public static class Rung {
        int number;
        /**
         * Banner comment; null for activation rungs.
         */
        String comment;
        String text;
    }
}
