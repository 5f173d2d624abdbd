package com.infrakit.synth.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.infrakit.synth.cli.exception.OptionsValidationException;
import com.infrakit.synth.cli.model.DiffOptions;
import com.infrakit.synth.cli.model.ValidatedDiffOptions;

public class DiffOptionsValidator {

	public ValidatedDiffOptions validate(DiffOptions o) {
		List<String> errors = new ArrayList<>();

		Path current = TemplateFileChecks.checkTemplateFile(o.getCurrent(), "--current", errors);
		Path previous = TemplateFileChecks.checkTemplateFile(o.getPrevious(), "--previous", errors);

		Path report = null;
		if (o.getReport() != null) {
			report = o.getReport().toAbsolutePath().normalize();
			if (Files.isDirectory(report)) {
				errors.add("Report path is a directory: " + report);
			} else if (Files.exists(report) && !o.isForce()) {
				errors.add("Report file already exists: " + report + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedDiffOptions(current, previous, report);
	}
}
