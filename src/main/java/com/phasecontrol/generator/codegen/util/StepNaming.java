package com.phasecontrol.generator.codegen.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Step-related naming shared by the emitters: banners and step-flag references for
 * both target platforms.
 */
@UtilityClass
public class StepNaming {

    public static final String RULE = "-".repeat(80);
    public static final String DOUBLE_RULE = "=".repeat(80);

    private static final Pattern ROCKWELL_STEP_FLAG = Pattern.compile("StepFlag\\[(\\d+)\\]\\.Flag",
            Pattern.CASE_INSENSITIVE);

    /**
     * {@code StepFlag[3].Flag}
     */
    public static String rockwellStepFlag(int stepIndex) {
        return "StepFlag[" + stepIndex + "].Flag";
    }

    /**
     * {@code #MyStepFlag.Step003}
     */
    public static String siemensStepFlag(int stepIndex) {
        return String.format("#MyStepFlag.Step%03d", stepIndex);
    }

    /**
     * Rewrites a Rockwell step-flag reference into its Siemens form; any other tag is
     * returned unchanged.
     */
    public static String toSiemensTag(String tag) {
        Matcher matcher = ROCKWELL_STEP_FLAG.matcher(tag);
        if (!matcher.matches()) {
            return tag;
        }
        try {
            return siemensStepFlag(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            // index too large for a step number; leave the tag as written
            return tag;
        }
    }

    /**
     * {@code Step 03 -- Fill}
     */
    public static String ladderTitle(int stepIndex, String stepName) {
        return String.format("Step %02d -- %s", stepIndex, stepName);
    }

    /**
     * {@code Step 03 - Fill}
     */
    public static String regionTitle(int stepIndex, String stepName) {
        return String.format("Step %02d - %s", stepIndex, stepName);
    }
}
