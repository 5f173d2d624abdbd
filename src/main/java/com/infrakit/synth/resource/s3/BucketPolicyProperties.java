package com.infrakit.synth.resource.s3;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Reference;
import com.infrakit.synth.resource.iam.PolicyDocument;

import lombok.Value;

@Value
public class BucketPolicyProperties {

    @JsonProperty("Bucket")
    Reference bucket;

    @JsonProperty("PolicyDocument")
    PolicyDocument policyDocument;
}
