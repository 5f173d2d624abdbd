package com.infrakit.synth.deploy;

import java.io.IOException;

import com.infrakit.synth.model.Asset;

/**
 * Copies one local artifact to its destination bucket and key.
 * Implementations must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface AssetUploader {

    void upload(Asset asset) throws IOException;
}
