package com.infrakit.synth.deploy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.model.Asset;
import com.infrakit.synth.util.FileWriteUtil;

/**
 * Stages assets in a local directory laid out as {@code <root>/<bucket>/<key>}. Useful
 * for dry runs and for feeding a separate sync step.
 */
public class LocalDirectoryAssetUploader implements AssetUploader {

    private static final Logger log = LoggerFactory.getLogger(LocalDirectoryAssetUploader.class);

    private final Path root;

    public LocalDirectoryAssetUploader(Path root) {
        this.root = root;
    }

    @Override
    public void upload(Asset asset) throws IOException {
        if (!Files.isRegularFile(asset.getLocalPath())) {
            throw new NoSuchFileException(asset.getLocalPath().toString(), null, "asset archive not found");
        }
        Path target = resolve(asset);
        FileWriteUtil.safeCopy(asset.getLocalPath(), target);
        log.debug("Staged {} at {}", asset.getLocalPath(), target);
    }

    public Path resolve(Asset asset) {
        return root.resolve(asset.getBucket()).resolve(asset.getKey());
    }
}
