package com.phasecontrol.generator.cli.model;

import java.nio.file.Path;

import com.phasecontrol.generator.codegen.model.ControllerType;
import com.phasecontrol.generator.codegen.rockwell.L5xTarget;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--activations", "-a" }, required = true, description = "JSON file with the step activation rows")
	private Path activationsFile;

	@Option(names = { "--conditions" }, description = "JSON file with custom activation conditions, keyed by step and suffixed tag")
	private Path conditionsFile;

	@Option(names = { "--config",
			"-c" }, defaultValue = "plc_config.json", description = "Mapping tables file; created with defaults if missing (default: ${DEFAULT-VALUE})")
	private Path configFile;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "output", description = "Output directory (default: ${DEFAULT-VALUE})")
	private Path outputDir;

	@Option(names = { "--controller",
			"-t" }, defaultValue = "ALL", description = "Target platform: ROCKWELL, SIEMENS or ALL (default: ${DEFAULT-VALUE})")
	private ControllerType controllerType;

	@Option(names = { "--phase-instance", "-p" }, description = "Only generate rows of this phase instance")
	private Integer phaseInstanceId;

	@Option(names = { "--controller-name" }, defaultValue = L5xTarget.DEFAULT_CONTROLLER, description = "Controller name in the L5X export")
	private String controllerName;

	@Option(names = { "--program-name" }, defaultValue = L5xTarget.DEFAULT_PROGRAM, description = "Program name in the L5X export")
	private String programName;

	@Option(names = { "--routine-name" }, defaultValue = L5xTarget.DEFAULT_ROUTINE, description = "Routine name in the L5X export")
	private String routineName;

	@Option(names = { "--preview" }, description = "Print the resolved activations per step and write nothing")
	private boolean preview;

}
