package com.infrakit.synth.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.cli.exception.OptionsValidationException;
import com.infrakit.synth.cli.model.DiffOptions;
import com.infrakit.synth.cli.model.ValidatedDiffOptions;
import com.infrakit.synth.cli.output.ResultsPrinter;
import com.infrakit.synth.cli.validation.DiffOptionsValidator;
import com.infrakit.synth.diff.StackDiff;
import com.infrakit.synth.diff.TemplateDiffEngine;
import com.infrakit.synth.report.StackReportGenerator;
import com.infrakit.synth.serialization.TemplateParseException;
import com.infrakit.synth.serialization.TemplateParser;
import com.infrakit.synth.stack.Template;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Compares two template files and prints which ResourceIds were added, removed or kept.
 * Removals are reported but do not fail the command.
 */
@Command(
        name = "diff",
        mixinStandardHelpOptions = true,
        description = "Shows the resources added, removed and kept between two templates."
)
public class DiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    @Mixin
    private DiffOptions options = new DiffOptions();

    private final DiffOptionsValidator validator = new DiffOptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        ValidatedDiffOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printErrors(e.getErrors());
            return 1;
        }

        printer.printDiffBanner(validated.getCurrent(), validated.getPrevious());
        try {
            TemplateParser parser = new TemplateParser();
            Template current = parser.parse(validated.getCurrent());
            Template previous = parser.parse(validated.getPrevious());

            StackDiff diff = new TemplateDiffEngine().diff(current, previous);
            printer.printDiff(diff);

            if (validated.getReport() != null) {
                new StackReportGenerator().write("Changes in " + validated.getCurrent().getFileName(), current, diff,
                        validated.getReport());
                printer.printReportWritten(validated.getReport());
            }
            return 0;
        } catch (TemplateParseException e) {
            log.error("Unable to read template: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Unable to write report: {}", e.getMessage());
            return 1;
        }
    }
}
