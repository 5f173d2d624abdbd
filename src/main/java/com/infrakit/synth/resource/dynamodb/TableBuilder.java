package com.infrakit.synth.resource.dynamodb;

import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.resource.dynamodb.TableProperties.AttributeDefinition;
import com.infrakit.synth.resource.dynamodb.TableProperties.KeySchemaElement;

/**
 * Starting state of a DynamoDB table. Keys and name are set here; {@link #payPerRequest()}
 * or {@link #provisioned()} must then be chosen, and only those states can build.
 *
 * <pre>
 * Table orders = TableBuilder.create("orders", Key.of("pk", AttributeType.S))
 *         .sortKey(Key.of("sk", AttributeType.S))
 *         .provisioned()
 *         .readCapacity(5)
 *         .writeCapacity(5)
 *         .build();
 * </pre>
 */
public class TableBuilder {

    final ResourceId resourceId;
    final Key partitionKey;
    final IdGenerator idGenerator;
    Key sortKey;
    String tableName;

    private TableBuilder(ResourceId resourceId, Key partitionKey, IdGenerator idGenerator) {
        this.resourceId = resourceId;
        this.partitionKey = partitionKey;
        this.idGenerator = idGenerator;
    }

    public static TableBuilder create(String id, Key partitionKey) {
        return create(id, partitionKey, IdGenerator.shared());
    }

    public static TableBuilder create(String id, Key partitionKey, IdGenerator idGenerator) {
        if (partitionKey == null) {
            throw new IllegalArgumentException("partition key is required");
        }
        return new TableBuilder(ResourceId.of(id), partitionKey, idGenerator);
    }

    public TableBuilder sortKey(Key sortKey) {
        this.sortKey = sortKey;
        return this;
    }

    public TableBuilder tableName(String tableName) {
        this.tableName = tableName;
        return this;
    }

    public OnDemandTableBuilder payPerRequest() {
        return new OnDemandTableBuilder(this);
    }

    public ProvisionedTableBuilder provisioned() {
        return new ProvisionedTableBuilder(this);
    }

    Table build(BillingMode billingMode,
                TableProperties.ProvisionedThroughput provisionedThroughput,
                TableProperties.OnDemandThroughput onDemandThroughput) {
        TableProperties.TablePropertiesBuilder properties = TableProperties.builder()
                .tableName(tableName)
                .billingMode(billingMode)
                .provisionedThroughput(provisionedThroughput)
                .onDemandThroughput(onDemandThroughput)
                .keySchemaElement(new KeySchemaElement(partitionKey.getName(), KeySchemaElement.HASH))
                .attributeDefinition(new AttributeDefinition(partitionKey.getName(), partitionKey.getType()));

        if (sortKey != null) {
            properties.keySchemaElement(new KeySchemaElement(sortKey.getName(), KeySchemaElement.RANGE))
                    .attributeDefinition(new AttributeDefinition(sortKey.getName(), sortKey.getType()));
        }

        return new Table(resourceId, idGenerator.generate(Table.KIND), properties.build());
    }
}
