package com.infrakit.synth;

import com.infrakit.synth.cli.SynthCommand;
import picocli.CommandLine;

/**
 * Main entry point of the infrakit command line: compares and inspects synthesized
 * templates.
 */
public class SynthApplication {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return SynthCommand.createCommandLine().execute(args);
    }
}
