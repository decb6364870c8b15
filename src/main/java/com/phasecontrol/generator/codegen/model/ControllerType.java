package com.phasecontrol.generator.codegen.model;

/**
 * Target platforms to generate for.
 */
public enum ControllerType {
    ROCKWELL,
    SIEMENS,
    ALL;

    public boolean includesRockwell() {
        return this == ROCKWELL || this == ALL;
    }

    public boolean includesSiemens() {
        return this == SIEMENS || this == ALL;
    }
}
