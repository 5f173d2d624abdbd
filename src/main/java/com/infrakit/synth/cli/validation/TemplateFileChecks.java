package com.infrakit.synth.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class TemplateFileChecks {

	private TemplateFileChecks() {
		// Utility class
	}

	static Path checkTemplateFile(Path file, String option, List<String> errors) {
		if (file == null) {
			errors.add("Template file is required (" + option + ").");
			return null;
		}
		Path normalized = file.toAbsolutePath().normalize();
		if (!Files.exists(normalized)) {
			errors.add("Template file does not exist: " + normalized);
		} else if (!Files.isRegularFile(normalized)) {
			errors.add("Template path is not a file: " + normalized);
		}
		return normalized;
	}
}
