package com.infrakit.synth.report;

import com.infrakit.synth.diff.StackDiff;
import com.infrakit.synth.diff.TemplateDiffEngine;
import com.infrakit.synth.model.GenericResource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.resource.lambda.Architecture;
import com.infrakit.synth.resource.lambda.Code;
import com.infrakit.synth.resource.lambda.FunctionBuilder;
import com.infrakit.synth.resource.lambda.Runtime;
import com.infrakit.synth.stack.StackBuilder;
import com.infrakit.synth.stack.Template;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Markdown stack report.
 */
class StackReportGeneratorTest {

    @TempDir
    Path tempDir;

    private final StackReportGenerator generator = new StackReportGenerator();

    @Test
    void testReportListsResourcesAssetsAndTags() throws Exception {
        Template template = new StackBuilder()
                .register(FunctionBuilder.create("api", Architecture.ARM64, 256, 10)
                        .code(Code.zip("assets", Path.of("build/api.zip")))
                        .handler("index.handler")
                        .runtime(Runtime.NODEJS_22)
                        .build())
                .tag("team", "payments")
                .build();

        String report = generator.render("Orders", template, null);

        assertThat(report).startsWith("# Orders");
        assertThat(report).contains("## Resources (2)");
        assertThat(report).contains("| api | LambdaFunction");
        assertThat(report).contains("| apiRole | LambdaFunctionRole");
        assertThat(report).contains("## Assets (1)");
        assertThat(report).contains("s3://assets/");
        assertThat(report).contains("- team: payments");
        assertThat(report).doesNotContain("## Changes");
    }

    @Test
    void testReportIncludesDiff() throws Exception {
        Template previous = Template.restore(List.of(
                new GenericResource(ResourceId.of("legacy"), SynthesizedId.of("SqsQueue1"), "AWS::SQS::Queue", null)),
                Map.of());
        Template current = Template.restore(List.of(
                new GenericResource(ResourceId.of("jobs"), SynthesizedId.of("SqsQueue2"), "AWS::SQS::Queue", null)),
                Map.of());
        StackDiff diff = new TemplateDiffEngine().diff(current, previous);

        String report = generator.render("Jobs", current, diff);

        assertThat(report).contains("## Changes");
        assertThat(report).contains("- added ids: jobs (resource SqsQueue2)");
        assertThat(report).contains("- removed ids: legacy (resource SqsQueue1)");
        assertThat(report).contains("- ids that stay: (none)");
        assertThat(report).contains("_No assets._");
        assertThat(report).doesNotContain("## Tags");
    }

    @Test
    void testUnchangedDiffSaysSo() throws Exception {
        String report = generator.render("Empty", Template.empty(),
                new TemplateDiffEngine().diff(Template.empty(), Template.empty()));

        assertThat(report).contains("_No resources._");
        assertThat(report).contains("No resources added or removed.");
    }

    @Test
    void testWriteCreatesFile() throws Exception {
        Path target = tempDir.resolve("reports/stack.md");

        generator.write("Empty", Template.empty(), null, target);

        assertThat(Files.readString(target)).startsWith("# Empty");
    }
}
