package com.infrakit.synth.resource.dynamodb;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.serialization.TemplateJson;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the DynamoDB table builder states.
 */
class TableBuilderTest {

    @Test
    void testProvisionedWithBothCapacitiesBuilds() {
        Table table = TableBuilder.create("orders", Key.of("pk", AttributeType.S))
                .provisioned()
                .readCapacity(5)
                .writeCapacity(10)
                .build();

        assertThat(table.getType()).isEqualTo(Table.TYPE);
        assertThat(table.getSynthesizedId().kindHint()).isEqualTo(Table.KIND);
        assertThat(table.getProperties().getBillingMode()).isEqualTo(BillingMode.PROVISIONED);
        assertThat(table.getProperties().getProvisionedThroughput().getReadCapacityUnits()).isEqualTo(5);
        assertThat(table.getProperties().getProvisionedThroughput().getWriteCapacityUnits()).isEqualTo(10);
        assertThat(table.getProperties().getOnDemandThroughput()).isNull();
    }

    @Test
    void testProvisionedWithoutCapacitiesReportsBoth() {
        ProvisionedTableBuilder builder = TableBuilder.create("orders", Key.of("pk", AttributeType.S))
                .provisioned();

        assertThatThrownBy(builder::build)
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getViolations())
                        .containsExactly(
                                "read capacity required when using provisioned billing",
                                "write capacity required when using provisioned billing"));
    }

    @Test
    void testProvisionedRejectsNonPositiveCapacity() {
        ProvisionedTableBuilder builder = TableBuilder.create("orders", Key.of("pk", AttributeType.S))
                .provisioned()
                .readCapacity(0)
                .writeCapacity(1);

        assertThatThrownBy(builder::build)
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("read capacity must be positive");
    }

    @Test
    void testPayPerRequestNeedsNoCapacity() {
        Table table = TableBuilder.create("events", Key.of("id", AttributeType.N))
                .payPerRequest()
                .build();

        assertThat(table.getProperties().getBillingMode()).isEqualTo(BillingMode.PAY_PER_REQUEST);
        assertThat(table.getProperties().getProvisionedThroughput()).isNull();
        assertThat(table.getProperties().getOnDemandThroughput()).isNull();
    }

    @Test
    void testPayPerRequestCeilings() {
        Table table = TableBuilder.create("events", Key.of("id", AttributeType.N))
                .payPerRequest()
                .maxReadCapacity(100)
                .build();

        assertThat(table.getProperties().getOnDemandThroughput().getMaxReadRequestUnits()).isEqualTo(100);
        assertThat(table.getProperties().getOnDemandThroughput().getMaxWriteRequestUnits()).isNull();

        OnDemandTableBuilder invalid = TableBuilder.create("events", Key.of("id", AttributeType.N))
                .payPerRequest()
                .maxWriteCapacity(-1);
        assertThatThrownBy(invalid::build).hasMessage("max write capacity must be positive");
    }

    @Test
    void testSortKeyAddsRangeElement() {
        Table table = TableBuilder.create("orders", Key.of("pk", AttributeType.S), new IdGenerator(new Random(1)))
                .sortKey(Key.of("sk", AttributeType.N))
                .tableName("orders-prod")
                .payPerRequest()
                .build();

        JsonNode json = TemplateJson.toTree(table.getProperties());

        assertThat(json.get("TableName").asText()).isEqualTo("orders-prod");
        assertThat(json.get("BillingMode").asText()).isEqualTo("PAY_PER_REQUEST");
        assertThat(json.get("KeySchema").get(0).get("KeyType").asText()).isEqualTo("HASH");
        assertThat(json.get("KeySchema").get(1).get("AttributeName").asText()).isEqualTo("sk");
        assertThat(json.get("KeySchema").get(1).get("KeyType").asText()).isEqualTo("RANGE");
        assertThat(json.get("AttributeDefinitions").get(1).get("AttributeType").asText()).isEqualTo("N");
        assertThat(json.has("ProvisionedThroughput")).isFalse();
    }

    @Test
    void testPartitionKeyIsRequired() {
        assertThatThrownBy(() -> TableBuilder.create("orders", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
