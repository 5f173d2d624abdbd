package com.infrakit.synth.resource.s3;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BucketProperties {

    @JsonProperty("BucketName")
    String bucketName;

    @JsonProperty("VersioningConfiguration")
    VersioningConfiguration versioningConfiguration;

    @JsonProperty("WebsiteConfiguration")
    WebsiteConfiguration websiteConfiguration;

    @JsonProperty("PublicAccessBlockConfiguration")
    PublicAccessBlockConfiguration publicAccessBlockConfiguration;

    @Value
    public static class VersioningConfiguration {

        @JsonProperty("Status")
        String status;
    }

    @Value
    public static class WebsiteConfiguration {

        @JsonProperty("IndexDocument")
        String indexDocument;

        @JsonProperty("ErrorDocument")
        String errorDocument;
    }

    @Value
    public static class PublicAccessBlockConfiguration {

        @JsonProperty("BlockPublicAcls")
        boolean blockPublicAcls;

        @JsonProperty("BlockPublicPolicy")
        boolean blockPublicPolicy;

        @JsonProperty("IgnorePublicAcls")
        boolean ignorePublicAcls;

        @JsonProperty("RestrictPublicBuckets")
        boolean restrictPublicBuckets;
    }
}
