package com.infrakit.synth.resource.lambda;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Asset;
import com.infrakit.synth.model.ConfigurationException;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Deployable code of a function: a local zip archive uploaded to a bucket, or inline
 * source text.
 */
public abstract class Code {

    private Code() {
    }

    /**
     * Code from a local archive. The upload key is derived from the normalized absolute
     * path, so every function pointing at the same archive shares one upload.
     */
    public static Zip zip(String bucket, Path archive) {
        if (bucket == null || bucket.isBlank()) {
            throw new ConfigurationException("zip code requires a bucket");
        }
        return zip(archive).withBucket(bucket);
    }

    /**
     * Code from a local archive; the bucket comes from the configured asset bucket.
     */
    public static Zip zip(Path archive) {
        if (archive == null) {
            throw new ConfigurationException("zip code requires an archive path");
        }
        Path normalized = archive.toAbsolutePath().normalize();
        if (!normalized.getFileName().toString().endsWith(".zip")) {
            throw new ConfigurationException("code archive must be a .zip file: " + archive);
        }
        return new Zip(null, keyFor(normalized), normalized);
    }

    public static Inline inline(String source) {
        if (source == null || source.isBlank()) {
            throw new ConfigurationException("inline code must not be empty");
        }
        return new Inline(source);
    }

    abstract List<Asset> assets();

    static String keyFor(Path normalized) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalized.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 16) + ".zip";
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Zip extends Code {

        @JsonProperty("S3Bucket")
        private final String bucket;

        @JsonProperty("S3Key")
        private final String key;

        @JsonIgnore
        private final Path localPath;

        private Zip(String bucket, String key, Path localPath) {
            this.bucket = bucket;
            this.key = key;
            this.localPath = localPath;
        }

        public Zip withBucket(String bucket) {
            return new Zip(bucket, key, localPath);
        }

        public boolean hasBucket() {
            return bucket != null && !bucket.isBlank();
        }

        @Override
        List<Asset> assets() {
            return List.of(new Asset(localPath, bucket, key));
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Inline extends Code {

        @JsonProperty("ZipFile")
        private final String source;

        private Inline(String source) {
            this.source = source;
        }

        @Override
        List<Asset> assets() {
            return List.of();
        }
    }
}
