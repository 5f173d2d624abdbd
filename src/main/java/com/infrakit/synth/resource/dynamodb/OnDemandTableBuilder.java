package com.infrakit.synth.resource.dynamodb;

import java.util.ArrayList;
import java.util.List;

import com.infrakit.synth.model.ConfigurationException;

/**
 * Pay-per-request billing: optional request ceilings, no fixed capacity.
 */
public class OnDemandTableBuilder {

    private final TableBuilder start;
    private Integer maxReadCapacity;
    private Integer maxWriteCapacity;

    OnDemandTableBuilder(TableBuilder start) {
        this.start = start;
    }

    public OnDemandTableBuilder maxReadCapacity(int maxReadCapacity) {
        this.maxReadCapacity = maxReadCapacity;
        return this;
    }

    public OnDemandTableBuilder maxWriteCapacity(int maxWriteCapacity) {
        this.maxWriteCapacity = maxWriteCapacity;
        return this;
    }

    public Table build() {
        List<String> violations = new ArrayList<>();
        if (maxReadCapacity != null && maxReadCapacity <= 0) {
            violations.add("max read capacity must be positive");
        }
        if (maxWriteCapacity != null && maxWriteCapacity <= 0) {
            violations.add("max write capacity must be positive");
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }

        TableProperties.OnDemandThroughput throughput = maxReadCapacity == null && maxWriteCapacity == null
                ? null
                : new TableProperties.OnDemandThroughput(maxReadCapacity, maxWriteCapacity);
        return start.build(BillingMode.PAY_PER_REQUEST, null, throughput);
    }
}
