package com.phasecontrol.generator.codegen.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * The three mapping tables that drive suffix resolution and reporting.
 *
 * Immutable; loaded once per run and passed explicitly to every component that
 * needs it.
 */
@Value
@Builder(toBuilder = true)
public class ConfigTables {

    /**
     * Device-class code to short device family name (V, AO, PID, ...).
     */
    @NonNull
    @Singular
    Map<Integer, String> deviceTypeNames;

    /**
     * Device-class code to tag suffix.
     */
    @NonNull
    @Singular
    Map<Integer, SuffixEntry> suffixRules;

    /**
     * Qualifier code to short qualifier name (N, S, R, SP, FO).
     */
    @NonNull
    @Singular
    Map<Integer, String> qualifierNames;

    public Optional<SuffixEntry> findSuffixRule(int deviceClassCode) {
        return Optional.ofNullable(suffixRules.get(deviceClassCode));
    }

    public String deviceTypeName(int deviceClassCode) {
        return deviceTypeNames.getOrDefault(deviceClassCode, String.valueOf(deviceClassCode));
    }

    public String qualifierName(int qualifierCode) {
        return qualifierNames.getOrDefault(qualifierCode, String.valueOf(qualifierCode));
    }

    /**
     * Built-in tables used when no configuration file is available.
     */
    public static ConfigTables defaults() {
        Map<Integer, SuffixEntry> suffixes = new LinkedHashMap<>();
        suffixes.put(0, PlainSuffix.of(".activate"));
        suffixes.put(1, PlainSuffix.of(".activateLL"));
        suffixes.put(2, PlainSuffix.of(".activateUL"));
        suffixes.put(6, PlainSuffix.of(".activate"));
        suffixes.put(7, PlainSuffix.of(".activate"));
        suffixes.put(8, QualifierSuffix.of(4, ".fixedoutput", ".closeloop"));
        suffixes.put(10, PlainSuffix.of(""));
        suffixes.put(13, PlainSuffix.of(".activate"));
        suffixes.put(14, QualifierSuffix.of(2, ".ResetTotalizer", ".EnableTotalizer"));

        return ConfigTables.builder()
                .deviceTypeName(0, "V")
                .deviceTypeName(1, "V")
                .deviceTypeName(2, "V")
                .deviceTypeName(6, "AO")
                .deviceTypeName(7, "DO")
                .deviceTypeName(8, "PID")
                .deviceTypeName(10, "Comm")
                .deviceTypeName(13, "VSD")
                .deviceTypeName(14, "TOT")
                .suffixRules(suffixes)
                .qualifierName(0, "N")
                .qualifierName(1, "S")
                .qualifierName(2, "R")
                .qualifierName(3, "SP")
                .qualifierName(4, "FO")
                .build();
    }
}
