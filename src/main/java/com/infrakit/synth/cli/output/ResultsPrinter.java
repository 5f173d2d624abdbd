package com.infrakit.synth.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.diff.StackDiff;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.stack.Template;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class ResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResultsPrinter.class);

    private static final String RULE = "=================================================";

    public void printDiffBanner(Path current, Path previous) {
        log.info(RULE);
        log.info("Template Diff");
        log.info(RULE);
        log.info("Current Template:  {}", current);
        log.info("Previous Template: {}", previous);
        log.info(RULE);
    }

    public void printDiff(StackDiff diff) {
        for (String line : diff.format().split(System.lineSeparator())) {
            log.info(line);
        }
        if (!diff.getRemoved().isEmpty()) {
            log.warn("{} resource(s) would be deleted on the next deployment", diff.getRemoved().size());
        }
    }

    public void printInspectBanner(Path template) {
        log.info(RULE);
        log.info("Template Inspection");
        log.info(RULE);
        log.info("Template: {}", template);
        log.info(RULE);
    }

    public void printTemplate(Template template) {
        log.info("Resources: {}", template.size());
        template.getResources().forEach(resource -> log.info("  {} ({}) {}",
                resource.getResourceId(), template.wireIdOf(resource.getSynthesizedId()), resource.getType()));
    }

    public void printMissingReferences(Map<ResourceId, List<SynthesizedId>> missing) {
        log.error("INTEGRITY CHECK FAILED");
        missing.forEach((resourceId, ids) -> log.error("  {} references unknown {}", resourceId, ids));
    }

    public void printIntegrityOk() {
        log.info("All references resolve.");
    }

    public void printReportWritten(Path report) {
        log.info("Report: {}", report);
    }

    public void printErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(error -> log.error("  {}", error));
    }
}
