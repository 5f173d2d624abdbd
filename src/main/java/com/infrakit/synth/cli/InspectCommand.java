package com.infrakit.synth.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.cli.exception.OptionsValidationException;
import com.infrakit.synth.cli.model.InspectOptions;
import com.infrakit.synth.cli.output.ResultsPrinter;
import com.infrakit.synth.cli.validation.InspectOptionsValidator;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.report.StackReportGenerator;
import com.infrakit.synth.serialization.TemplateParseException;
import com.infrakit.synth.serialization.TemplateParser;
import com.infrakit.synth.stack.ReferenceIntegrityChecker;
import com.infrakit.synth.stack.Template;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Reads a template file, lists its resources and verifies that every reference in it
 * points at a resource of the same template.
 */
@Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        description = "Lists the resources of a template and checks its references."
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @Mixin
    private InspectOptions options = new InspectOptions();

    private final InspectOptionsValidator validator = new InspectOptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        Path templatePath;
        try {
            templatePath = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printErrors(e.getErrors());
            return 1;
        }

        printer.printInspectBanner(templatePath);
        try {
            Template template = new TemplateParser().parse(templatePath);
            printer.printTemplate(template);

            if (options.getReport() != null) {
                new StackReportGenerator().write("Template " + templatePath.getFileName(), template, null,
                        options.getReport());
                printer.printReportWritten(options.getReport());
            }

            Map<ResourceId, List<SynthesizedId>> missing =
                    new ReferenceIntegrityChecker().findMissing(template.getResources());
            if (!missing.isEmpty()) {
                printer.printMissingReferences(missing);
                return 1;
            }
            printer.printIntegrityOk();
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
