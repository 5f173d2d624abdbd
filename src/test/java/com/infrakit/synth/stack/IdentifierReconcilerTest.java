package com.infrakit.synth.stack;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.GenericResource;
import com.infrakit.synth.model.IntrinsicFunctions;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IdentifierReconciler.
 */
class IdentifierReconcilerTest {

    private final IdentifierReconciler reconciler = new IdentifierReconciler();

    private static GenericResource table(String sid) {
        return new GenericResource(ResourceId.of("table"), SynthesizedId.of(sid), "AWS::DynamoDB::Table", null);
    }

    private static GenericResource reader(String sid, String tableSid) {
        ObjectNode props = JsonNodeFactory.instance.objectNode();
        props.set("Table", IntrinsicFunctions.ref(tableSid));
        return new GenericResource(ResourceId.of("reader"), SynthesizedId.of(sid), "AWS::Lambda::Function", props);
    }

    private static Template template(GenericResource... resources) throws IntegrityException {
        return new StackBuilder().registerMany(resources).build();
    }

    @Test
    void testKnownResourceIdKeepsDeployedId() throws Exception {
        Template current = template(table("DynamoDBTable1"), reader("LambdaFunction2", "DynamoDBTable1"));

        Template reconciled = reconciler.reconcile(current,
                Map.of(ResourceId.of("table"), SynthesizedId.of("DynamoDBTable77")));

        assertThat(reconciled.getMetadata())
                .containsEntry(ResourceId.of("table"), SynthesizedId.of("DynamoDBTable77"))
                .containsEntry(ResourceId.of("reader"), SynthesizedId.of("LambdaFunction2"));
        assertThat(reconciled.getRenamedIds())
                .containsExactly(Map.entry(SynthesizedId.of("DynamoDBTable1"), SynthesizedId.of("DynamoDBTable77")));

        JsonNode readerProps = ReferenceScanner.rewrite(
                (JsonNode) reconciled.get(SynthesizedId.of("LambdaFunction2")).orElseThrow().getProperties(),
                reconciled.getRenamedIds());
        assertThat(readerProps.get("Table").get("Ref").asText()).isEqualTo("DynamoDBTable77");
    }

    @Test
    void testReconcileAgainstDeployedTemplate() throws Exception {
        Template deployed = template(table("DynamoDBTable5"));
        Template current = template(table("DynamoDBTable1"), reader("LambdaFunction2", "DynamoDBTable1"));

        Template reconciled = reconciler.reconcile(current, deployed);

        assertThat(reconciled.wireIdOf(SynthesizedId.of("DynamoDBTable1"))).isEqualTo(SynthesizedId.of("DynamoDBTable5"));
        assertThat(reconciled.size()).isEqualTo(2);
    }

    @Test
    void testEmptyInputsAreNoOp() throws Exception {
        Template current = template(table("DynamoDBTable1"));

        assertThat(reconciler.reconcile(current, Template.empty())).isSameAs(current);
        assertThat(reconciler.reconcile(Template.empty(), current)).isSameAs(Template.empty());
    }

    @Test
    void testDeployedIdAlreadyUsedIsNotReused() throws Exception {
        Template current = template(table("DynamoDBTable1"), reader("LambdaFunction2", "DynamoDBTable1"));

        Template reconciled = reconciler.reconcile(current,
                Map.of(ResourceId.of("table"), SynthesizedId.of("LambdaFunction2")));

        assertThat(reconciled.getRenamedIds()).isEmpty();
    }
}
