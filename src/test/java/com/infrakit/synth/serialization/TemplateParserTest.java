package com.infrakit.synth.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.stack.Template;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TemplateParserTest {

    @TempDir
    Path tempDir;

    private final TemplateParser parser = new TemplateParser();

    private static String json(String text) {
        return text.replace('\'', '"');
    }

    @Test
    void testParsesResourcesAndMetadata() throws Exception {
        Template template = parser.parse(json("{'Resources':{"
                + "'SqsQueue1':{'Type':'AWS::SQS::Queue','Properties':{'QueueName':'orders'}},"
                + "'LambdaFunction2':{'Type':'AWS::Lambda::Function','Properties':{'Role':{'Ref':'SqsQueue1'}}}},"
                + "'Metadata':{'orders':'SqsQueue1','worker':'LambdaFunction2'}}"));

        assertThat(template.size()).isEqualTo(2);
        assertThat(template.getMetadata())
                .containsEntry(ResourceId.of("orders"), SynthesizedId.of("SqsQueue1"))
                .containsEntry(ResourceId.of("worker"), SynthesizedId.of("LambdaFunction2"));

        Resource queue = template.findByResourceId(ResourceId.of("orders")).orElseThrow();
        assertThat(queue.getType()).isEqualTo("AWS::SQS::Queue");
        assertThat(((JsonNode) queue.getProperties()).get("QueueName").asText()).isEqualTo("orders");
    }

    @Test
    void testResourceWithoutMetadataIsNamedByWireId() throws Exception {
        Template template = parser.parse(json("{'Resources':{'Bucket9':{'Type':'AWS::S3::Bucket'}},"
                + "'Metadata':{'AWS::Other':{'Nested':true}}}"));

        assertThat(template.getMetadata()).containsExactly(
                Map.entry(ResourceId.of("Bucket9"), SynthesizedId.of("Bucket9")));
    }

    @Test
    void testWireIdFallbackClashingWithMetadataIdIsRejected() {
        assertThatThrownBy(() -> parser.parse(json("{'Resources':{"
                + "'A1':{'Type':'AWS::SQS::Queue'},"
                + "'orders':{'Type':'AWS::SNS::Topic'}},"
                + "'Metadata':{'orders':'A1'}}")))
                .isInstanceOf(TemplateParseException.class)
                .hasMessageContaining("Resource id 'orders' names more than one resource");
    }

    @Test
    void testTwoMetadataEntriesForOneWireIdAreRejected() {
        assertThatThrownBy(() -> parser.parse(json("{'Resources':{'A1':{'Type':'AWS::SQS::Queue'}},"
                + "'Metadata':{'orders':'A1','invoices':'A1'}}")))
                .isInstanceOf(TemplateParseException.class)
                .hasMessageContaining("'orders' and 'invoices' both point at wire id 'A1'");
    }

    @Test
    void testParsesFromFile() throws Exception {
        Path file = tempDir.resolve("deployed.json");
        Files.writeString(file, json("{'Resources':{}}"));

        assertThat(parser.parse(file).isEmpty()).isTrue();
    }

    @Test
    void testMissingFileIsParseError() {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.json")))
                .isInstanceOf(TemplateParseException.class)
                .hasMessageContaining("Could not read template file");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
            "`   `|Template body is empty",
            "not json|not valid JSON",
            "[1,2]|must be a JSON object",
            "{'Metadata':{}}|has no 'Resources' object",
            "{'Resources':{'A1':'text'}}|'A1' must be a JSON object",
            "{'Resources':{'A1':{'Properties':{}}}}|'A1' has no 'Type'",
            "{'Resources':{'A1':{'Type':'X','Properties':[1]}}}|Properties of resource 'A1' must be a JSON object",
            "{'Resources':{},'Metadata':[1]}|'Metadata' must be a JSON object"
    })
    void testMalformedBodiesAreRejected(String body, String message) {
        assertThatThrownBy(() -> parser.parse(json(body)))
                .isInstanceOf(TemplateParseException.class)
                .hasMessageContaining(message);
    }
}
