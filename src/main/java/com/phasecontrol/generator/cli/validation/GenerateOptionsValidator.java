package com.phasecontrol.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.phasecontrol.generator.cli.exception.OptionsValidationException;
import com.phasecontrol.generator.cli.model.GenerateOptions;
import com.phasecontrol.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getActivationsFile() == null) {
			errors.add("Activation file is required (--activations / -a).");
		} else if (!Files.isRegularFile(o.getActivationsFile())) {
			errors.add("Activation file does not exist or is not a file: " + o.getActivationsFile());
		}

		if (o.getConditionsFile() != null && !Files.isRegularFile(o.getConditionsFile())) {
			errors.add("Condition file does not exist or is not a file: " + o.getConditionsFile());
		}

		if (o.getConfigFile() != null && Files.isDirectory(o.getConfigFile())) {
			errors.add("Config file path is a directory: " + o.getConfigFile());
		}

		if (o.getPhaseInstanceId() != null && o.getPhaseInstanceId() < 0) {
			errors.add("Phase instance id must be >= 0. Got: " + o.getPhaseInstanceId());
		}

		if (isBlank(o.getControllerName())) {
			errors.add("Controller name must not be blank (--controller-name).");
		}
		if (isBlank(o.getProgramName())) {
			errors.add("Program name must not be blank (--program-name).");
		}
		if (isBlank(o.getRoutineName())) {
			errors.add("Routine name must not be blank (--routine-name).");
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of("output") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		Path normalizedConfigFile = o.getConfigFile() == null ? null : o.getConfigFile().toAbsolutePath().normalize();

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutputDir, normalizedConfigFile);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
