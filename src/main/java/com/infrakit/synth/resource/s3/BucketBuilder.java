package com.infrakit.synth.resource.s3;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.IntrinsicFunctions;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.resource.iam.Effect;
import com.infrakit.synth.resource.iam.PolicyDocument;
import com.infrakit.synth.resource.iam.Principal;
import com.infrakit.synth.resource.iam.Statement;

/**
 * Builds an S3 bucket. A static website makes the bucket publicly readable, which
 * yields an extra {@link BucketPolicy}.
 *
 * <p>Bucket names are global. When a {@link NameAvailabilityCache} is supplied, a name
 * known to be taken fails the build; on a cache miss the optional
 * {@link NameAvailabilityProbe} is asked and its answer recorded.</p>
 */
public class BucketBuilder {

    private static final Logger log = LoggerFactory.getLogger(BucketBuilder.class);

    private static final Pattern BUCKET_NAME = Pattern.compile("[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]");

    private final ResourceId resourceId;
    private IdGenerator idGenerator = IdGenerator.shared();
    private String bucketName;
    private boolean versioned;
    private String indexDocument;
    private String errorDocument;
    private NameAvailabilityCache nameCache;
    private NameAvailabilityProbe nameProbe;

    private BucketBuilder(ResourceId resourceId) {
        this.resourceId = resourceId;
    }

    public static BucketBuilder create(String id) {
        return new BucketBuilder(ResourceId.of(id));
    }

    public BucketBuilder bucketName(String bucketName) {
        this.bucketName = bucketName;
        return this;
    }

    public BucketBuilder versioned() {
        this.versioned = true;
        return this;
    }

    public BucketBuilder website(String indexDocument, String errorDocument) {
        this.indexDocument = indexDocument;
        this.errorDocument = errorDocument;
        return this;
    }

    public BucketBuilder nameAvailability(NameAvailabilityCache cache) {
        return nameAvailability(cache, null);
    }

    public BucketBuilder nameAvailability(NameAvailabilityCache cache, NameAvailabilityProbe probe) {
        this.nameCache = cache;
        this.nameProbe = probe;
        return this;
    }

    public BucketBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public BucketResources build() {
        List<String> violations = new ArrayList<>();
        if (bucketName != null) {
            if (!BUCKET_NAME.matcher(bucketName).matches() || bucketName.contains("..")) {
                violations.add("invalid bucket name: " + bucketName);
            } else if (!isAvailable(bucketName)) {
                violations.add("bucket name is already taken: " + bucketName);
            }
        }
        if (indexDocument != null && indexDocument.isBlank()) {
            violations.add("website index document must not be blank");
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }

        boolean website = indexDocument != null;
        BucketProperties properties = BucketProperties.builder()
                .bucketName(bucketName)
                .versioningConfiguration(versioned ? new BucketProperties.VersioningConfiguration("Enabled") : null)
                .websiteConfiguration(website
                        ? new BucketProperties.WebsiteConfiguration(indexDocument, errorDocument)
                        : null)
                .publicAccessBlockConfiguration(website
                        ? new BucketProperties.PublicAccessBlockConfiguration(false, false, false, false)
                        : null)
                .build();
        Bucket bucket = new Bucket(resourceId, idGenerator.generate(Bucket.KIND), properties);

        BucketPolicy policy = null;
        if (website) {
            Statement publicRead = Statement.builder()
                    .effect(Effect.ALLOW)
                    .principal(Principal.everyone())
                    .action("s3:GetObject")
                    .resource(IntrinsicFunctions.join("", List.of(bucket.arn(), "/*")))
                    .build();
            policy = new BucketPolicy(resourceId.withSuffix("Policy"), idGenerator.generate(BucketPolicy.KIND),
                    new BucketPolicyProperties(bucket.ref(), PolicyDocument.of(publicRead)));
        }
        return new BucketResources(bucket, policy);
    }

    private boolean isAvailable(String name) {
        if (nameCache == null) {
            return true;
        }
        Optional<Boolean> cached = nameCache.lookup(name);
        if (cached.isPresent()) {
            log.debug("Bucket name '{}' availability from cache: {}", name, cached.get());
            return cached.get();
        }
        if (nameProbe == null) {
            return true;
        }
        boolean available = nameProbe.isAvailable(name);
        nameCache.record(name, available);
        return available;
    }
}
