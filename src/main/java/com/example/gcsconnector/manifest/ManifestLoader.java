package com.example.gcsconnector.manifest;

import com.example.gcsconnector.exception.ConfigurationException;
import com.example.gcsconnector.exception.StorageException;
import com.example.gcsconnector.storage.BucketHandle;
import com.example.gcsconnector.storage.StorageClient;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the manifest template once at startup, from local disk or from a gs:// object.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManifestLoader {

    private final StorageClient storageClient;
    private final ManifestMerger manifestMerger;

    public ManifestSpec load(String source, String fieldPath) {
        ManifestSpec spec = new ManifestSpec(source, fieldPath, null);
        return spec.withTemplate(spec.isRemote() ? loadRemote(spec) : loadLocal(spec));
    }

    private ObjectNode loadRemote(ManifestSpec spec) {
        if (spec.bucket().isEmpty() || spec.key().isEmpty() || spec.key().endsWith("/")) {
            throw new ConfigurationException("manifest must have both bucket and a path/file name: '" + spec.source() + "'");
        }
        try {
            BucketHandle bucket = storageClient.resolveBucket(spec.bucket());
            Optional<byte[]> content = storageClient.getBlob(bucket, spec.key());
            if (content.isEmpty()) {
                log.info("No manifest at {} yet, starting from an empty document", spec.source());
                return null;
            }
            return manifestMerger.parse(content.get());
        } catch (StorageException e) {
            throw new ConfigurationException("Failed to load manifest " + spec.source(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Manifest " + spec.source() + " is not valid JSON", e);
        }
    }

    private ObjectNode loadLocal(ManifestSpec spec) {
        Path path = spec.localPath();
        try {
            ObjectNode template = manifestMerger.parse(Files.readAllBytes(path));
            log.info("Loaded manifest template from {}", path);
            return template;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load manifest " + spec.source(), e);
        }
    }
}
