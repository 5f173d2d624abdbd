package com.infrakit.synth.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "inspect" command.
 */
@Getter
@Setter
public class InspectOptions {

	@Option(names = { "--template", "-t" }, description = "Template file to inspect")
	private Path template;

	@Option(names = { "--report", "-r" }, description = "Also write a Markdown report to this file")
	private Path report;
}
