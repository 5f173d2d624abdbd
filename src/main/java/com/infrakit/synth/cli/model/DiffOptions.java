package com.infrakit.synth.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "diff" command. No validation, no execution logic, no
 * printing.
 */
@Getter
@Setter
public class DiffOptions {

	@Option(names = { "--current", "-c" }, description = "Template produced by the latest synthesis")
	private Path current;

	@Option(names = { "--previous", "-p" }, description = "Template that is currently deployed")
	private Path previous;

	@Option(names = { "--report", "-r" }, description = "Also write a Markdown report to this file")
	private Path report;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing report file")
	private boolean force;
}
