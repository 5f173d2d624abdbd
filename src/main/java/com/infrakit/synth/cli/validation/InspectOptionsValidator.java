package com.infrakit.synth.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.infrakit.synth.cli.exception.OptionsValidationException;
import com.infrakit.synth.cli.model.InspectOptions;

public class InspectOptionsValidator {

	/**
	 * @return the normalized template path
	 */
	public Path validate(InspectOptions o) {
		List<String> errors = new ArrayList<>();

		Path template = TemplateFileChecks.checkTemplateFile(o.getTemplate(), "--template", errors);
		if (o.getReport() != null && Files.isDirectory(o.getReport())) {
			errors.add("Report path is a directory: " + o.getReport());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return template;
	}
}
