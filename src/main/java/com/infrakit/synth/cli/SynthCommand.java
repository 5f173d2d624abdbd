package com.infrakit.synth.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command; only dispatches to its subcommands.
 */
@Command(
        name = "infrakit",
        mixinStandardHelpOptions = true,
        version = "infrakit-synth 1.0.0",
        description = "Compares and inspects synthesized infrastructure templates.",
        subcommands = {DiffCommand.class, InspectCommand.class}
)
public class SynthCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    public static CommandLine createCommandLine() {
        return new CommandLine(new SynthCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
