package com.infrakit.synth.resource.dynamodb;

import java.util.ArrayList;
import java.util.List;

import com.infrakit.synth.model.ConfigurationException;

/**
 * Provisioned billing: fixed read and write capacity are both required.
 */
public class ProvisionedTableBuilder {

    private final TableBuilder start;
    private Integer readCapacity;
    private Integer writeCapacity;

    ProvisionedTableBuilder(TableBuilder start) {
        this.start = start;
    }

    public ProvisionedTableBuilder readCapacity(int readCapacity) {
        this.readCapacity = readCapacity;
        return this;
    }

    public ProvisionedTableBuilder writeCapacity(int writeCapacity) {
        this.writeCapacity = writeCapacity;
        return this;
    }

    public Table build() {
        List<String> violations = new ArrayList<>();
        if (readCapacity == null) {
            violations.add("read capacity required when using provisioned billing");
        } else if (readCapacity <= 0) {
            violations.add("read capacity must be positive");
        }
        if (writeCapacity == null) {
            violations.add("write capacity required when using provisioned billing");
        } else if (writeCapacity <= 0) {
            violations.add("write capacity must be positive");
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }

        return start.build(BillingMode.PROVISIONED,
                new TableProperties.ProvisionedThroughput(readCapacity, writeCapacity), null);
    }
}
