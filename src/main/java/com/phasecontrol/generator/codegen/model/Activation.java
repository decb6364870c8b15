package com.phasecontrol.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One (step, device) pairing as delivered by the activation source.
 *
 * Pure structure only. A row without a tag still names its step so the step is
 * listed even when nothing is activated in it.
 */
@Value
@Builder(toBuilder = true)
public class Activation {

    /**
     * Phase instance the row belongs to, when the source knows it.
     */
    Integer phaseInstanceId;

    int stepIndex;

    @NonNull
    String stepName;

    /**
     * Device family selector (valve, analog output, PID loop, totalizer, ...).
     */
    int deviceClassCode;

    /**
     * Refines the device family; 0 when absent.
     */
    int qualifierCode;

    /**
     * Output tag, or null for a step placeholder row.
     */
    String tag;

    public boolean hasActivation() {
        return tag != null;
    }
}
