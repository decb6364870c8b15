package com.phasecontrol.generator;

import com.phasecontrol.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Phase PLC Generator.
 * This CLI tool turns phase step activations into Rockwell ladder logic (text and
 * L5X) and Siemens SCL.
 */
public class PlcGeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
