package com.example.gcsconnector.manifest;

import com.example.gcsconnector.exception.StorageException;
import com.example.gcsconnector.storage.BlobHandle;
import com.example.gcsconnector.storage.StorageClient;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps one uploader's view of the manifest and publishes it after each batch.
 * Names whose publish failed stay in a backlog and go out with the next batch.
 * Not thread safe, owned by a single uploader thread.
 */
@Slf4j
public class ManifestPublisher {

    private static final String CONTENT_TYPE = "application/json";

    private final ManifestSpec spec;
    private final BlobHandle target;
    private final StorageClient storageClient;
    private final ManifestMerger manifestMerger;

    private final List<String> backlog = new ArrayList<>();
    private ObjectNode current;

    public ManifestPublisher(ManifestSpec spec, BlobHandle target, StorageClient storageClient,
                             ManifestMerger manifestMerger) {
        this.spec = spec;
        this.target = target;
        this.storageClient = storageClient;
        this.manifestMerger = manifestMerger;
        this.current = spec.template();
    }

    /**
     * @return true if a manifest was uploaded
     */
    public boolean publish(List<String> names) {
        backlog.addAll(names);
        if (backlog.isEmpty()) {
            return false;
        }
        try {
            ObjectNode template = spec.isRemote() ? reload() : current;
            ObjectNode merged = manifestMerger.merge(template, spec.fieldPath(), backlog);
            storageClient.uploadBytes(target, manifestMerger.serialize(merged), CONTENT_TYPE);
            log.info("Published manifest {} with {} new file(s)", target, backlog.size());
            current = merged;
            backlog.clear();
            return true;
        } catch (StorageException e) {
            log.warn("Failed to publish manifest {}, {} file name(s) kept for the next cycle",
                    target, backlog.size(), e);
            return false;
        }
    }

    private ObjectNode reload() {
        return storageClient.getBlob(target.bucket(), target.key())
                .map(this::parseOrCurrent)
                .orElse(current);
    }

    private ObjectNode parseOrCurrent(byte[] content) {
        try {
            return manifestMerger.parse(content);
        } catch (IOException e) {
            log.warn("Remote manifest {} is unreadable, merging into the last known copy", target, e);
            return current;
        }
    }

    public BlobHandle getTarget() {
        return target;
    }

    public ObjectNode getCurrent() {
        return current;
    }

    public int getBacklogSize() {
        return backlog.size();
    }
}
