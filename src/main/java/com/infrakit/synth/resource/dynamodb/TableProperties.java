package com.infrakit.synth.resource.dynamodb;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TableProperties {

    @JsonProperty("TableName")
    String tableName;

    @Singular("keySchemaElement")
    @JsonProperty("KeySchema")
    List<KeySchemaElement> keySchema;

    @Singular("attributeDefinition")
    @JsonProperty("AttributeDefinitions")
    List<AttributeDefinition> attributeDefinitions;

    @JsonProperty("BillingMode")
    BillingMode billingMode;

    @JsonProperty("ProvisionedThroughput")
    ProvisionedThroughput provisionedThroughput;

    @JsonProperty("OnDemandThroughput")
    OnDemandThroughput onDemandThroughput;

    @Value
    public static class KeySchemaElement {

        public static final String HASH = "HASH";
        public static final String RANGE = "RANGE";

        @JsonProperty("AttributeName")
        String attributeName;

        @JsonProperty("KeyType")
        String keyType;
    }

    @Value
    public static class AttributeDefinition {

        @JsonProperty("AttributeName")
        String attributeName;

        @JsonProperty("AttributeType")
        AttributeType attributeType;
    }

    @Value
    public static class ProvisionedThroughput {

        @JsonProperty("ReadCapacityUnits")
        int readCapacityUnits;

        @JsonProperty("WriteCapacityUnits")
        int writeCapacityUnits;
    }

    @Value
    public static class OnDemandThroughput {

        @JsonProperty("MaxReadRequestUnits")
        Integer maxReadRequestUnits;

        @JsonProperty("MaxWriteRequestUnits")
        Integer maxWriteRequestUnits;
    }
}
