package com.phasecontrol.generator.codegen.input;

import java.io.IOException;
import java.util.List;

import com.phasecontrol.generator.codegen.model.Activation;

/**
 * Supplies activation rows ordered by step, including placeholder rows for steps
 * without any activation.
 */
public interface ActivationSource {

    /**
     * @param phaseInstanceId restricts the rows to one phase instance; null for all
     */
    List<Activation> fetchActivations(Integer phaseInstanceId) throws IOException;
}
