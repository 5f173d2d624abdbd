package com.infrakit.synth.resource.dynamodb;

public enum BillingMode {
    PAY_PER_REQUEST,
    PROVISIONED
}
