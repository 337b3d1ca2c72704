package com.example.gcsconnector.service;

import com.example.gcsconnector.config.ConnectorConfigNormalizer;
import com.example.gcsconnector.config.ConnectorProperties;
import com.example.gcsconnector.exception.ConfigurationException;
import com.example.gcsconnector.exception.StorageException;
import com.example.gcsconnector.manifest.ManifestLoader;
import com.example.gcsconnector.manifest.ManifestMerger;
import com.example.gcsconnector.manifest.ManifestPublisher;
import com.example.gcsconnector.manifest.ManifestSpec;
import com.example.gcsconnector.model.ConnectorConfig;
import com.example.gcsconnector.model.UploadTarget;
import com.example.gcsconnector.model.UploaderStatus;
import com.example.gcsconnector.storage.BlobHandle;
import com.example.gcsconnector.storage.BucketHandle;
import com.example.gcsconnector.storage.StorageClient;
import com.example.gcsconnector.worker.CancellationToken;
import com.example.gcsconnector.worker.DirectoryUploader;
import com.example.gcsconnector.worker.FileUploader;
import com.example.gcsconnector.worker.SegmentUploader;
import com.example.gcsconnector.worker.UploaderContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owns the uploaders: builds one per output plus one for the image directory, runs each on
 * its own thread, and routes closed segments reported by the upstream sink to them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectorService {

    private static final long MAX_RESOLVE_BACKOFF_MS = 30000;

    static final String IMAGE_SUBFOLDER = "images";

    private final ConnectorProperties properties;
    private final StorageClient storageClient;
    private final ManifestLoader manifestLoader;
    private final ManifestMerger manifestMerger;

    private final CancellationToken cancellation = new CancellationToken();
    private final List<FileUploader> uploaders = new ArrayList<>();
    private final List<SegmentUploader> segmentUploaders = new ArrayList<>();

    private volatile ConnectorConfig config;
    private ExecutorService executor;

    @PostConstruct
    public void start() {
        setup(ConnectorConfigNormalizer.normalize(properties));

        executor = Executors.newFixedThreadPool(uploaders.size(), new CustomizableThreadFactory("uploader-"));
        for (FileUploader uploader : uploaders) {
            executor.execute(() -> uploader.run(cancellation));
        }
        log.info("Started {} uploader(s)", uploaders.size());
    }

    /**
     * Builds the uploaders without starting them. Fails on the first bucket or manifest
     * that cannot be resolved.
     */
    public synchronized void setup(ConnectorConfig config) {
        if (this.config != null) {
            throw new IllegalStateException("Connector is already set up");
        }
        createDirectories(config.workdir());

        ManifestSpec manifest = config.hasManifest()
                ? manifestLoader.load(config.manifest(), config.manifestField())
                : null;

        Map<String, BucketHandle> buckets = new HashMap<>();
        List<UploadTarget> outputs = config.outputs();
        for (int i = 0; i < outputs.size(); i++) {
            UploadTarget target = outputs.get(i);
            BucketHandle bucket = buckets.computeIfAbsent(target.bucket(), this::resolveBucket);
            UploaderContext context = UploaderContext.builder()
                    .name("segment-" + i)
                    .storageClient(storageClient)
                    .bucket(bucket)
                    .blobPath(target.blobPath())
                    .directory(config.workdir())
                    .interval(target.interval())
                    .timeout(target.timeout())
                    .manifestPublisher(publisherFor(manifest, buckets, bucket, target.blobPath()))
                    .build();
            SegmentUploader uploader = new SegmentUploader(context, target.prefix(), config.settleTime());
            segmentUploaders.add(uploader);
            uploaders.add(uploader);
            log.info("Output {} uploads segments with prefix '{}' from {}", target.output(), target.prefix(),
                    config.workdir());
        }

        if (config.imageDirectory() != null) {
            createDirectories(config.imageDirectory());
            UploadTarget first = outputs.get(0);
            BucketHandle bucket = buckets.get(first.bucket());
            String imagePath = first.blobKey(IMAGE_SUBFOLDER);
            UploaderContext context = UploaderContext.builder()
                    .name("images")
                    .storageClient(storageClient)
                    .bucket(bucket)
                    .blobPath(imagePath)
                    .directory(config.imageDirectory())
                    .interval(first.interval())
                    .timeout(config.timeout())
                    .manifestPublisher(publisherFor(manifest, buckets, bucket, imagePath))
                    .build();
            uploaders.add(new DirectoryUploader(context));
            log.info("Watching {} for files to upload to gs://{}/{}", config.imageDirectory(), bucket.name(),
                    imagePath);
        }

        this.config = config;
    }

    /**
     * Queues a finalized segment on the uploader of {@code output}.
     *
     * @throws IllegalArgumentException if the output is unknown
     */
    public void onSegmentClosed(String output, Path segment) {
        SegmentUploader uploader = uploaderFor(output);
        uploader.enqueue(segment);
        log.debug("Queued {} on {}", segment, uploader.getContext().name());
    }

    private SegmentUploader uploaderFor(String output) {
        ConnectorConfig current = config;
        if (current == null) {
            throw new IllegalStateException("Connector is not set up");
        }
        if (!StringUtils.hasText(output)) {
            if (segmentUploaders.size() == 1) {
                return segmentUploaders.get(0);
            }
            throw new IllegalArgumentException("output must be given when more than one output is configured");
        }
        String wanted = output.trim();
        List<UploadTarget> outputs = current.outputs();
        for (int i = 0; i < outputs.size(); i++) {
            UploadTarget target = outputs.get(i);
            if (wanted.equals(target.output()) || wanted.equals(target.location()) || wanted.equals(String.valueOf(i))) {
                return segmentUploaders.get(i);
            }
        }
        throw new IllegalArgumentException("Unknown output: " + output);
    }

    @PreDestroy
    public void stop() {
        cancellation.cancel();
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            long waitMs = config.shutdownTimeout().toMillis();
            if (!executor.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Uploaders did not stop within {} ms, interrupting them", waitMs);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (FileUploader uploader : uploaders) {
            UploaderStatus status = uploader.status();
            if (status.queued() > 0) {
                log.warn("Uploader {} stopped with {} file(s) not uploaded", status.name(), status.queued());
            }
        }
        log.info("Stopped {} uploader(s)", uploaders.size());
    }

    private ManifestPublisher publisherFor(ManifestSpec manifest, Map<String, BucketHandle> buckets,
                                           BucketHandle bucket, String blobPath) {
        if (manifest == null) {
            return null;
        }
        BlobHandle target;
        if (manifest.isRemote()) {
            target = storageClient.blob(buckets.computeIfAbsent(manifest.bucket(), this::resolveBucket), manifest.key());
        } else {
            String key = blobPath.isEmpty() ? manifest.fileName() : blobPath + "/" + manifest.fileName();
            target = storageClient.blob(bucket, key);
        }
        return new ManifestPublisher(manifest, target, storageClient, manifestMerger);
    }

    BucketHandle resolveBucket(String name) {
        int attempts = Math.max(1, properties.getStorage().getResolveAttempts());
        long backoffMs = properties.getStorage().getResolveBackoff().toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return storageClient.resolveBucket(name);
            } catch (StorageException e) {
                if (attempt >= attempts) {
                    log.error("Failed to resolve bucket {} after {} attempt(s)", name, attempts);
                    throw e;
                }
                log.warn("Failed to resolve bucket {} (attempt {}/{}): {}", name, attempt, attempts, e.getMessage());
                try {
                    Thread.sleep(backoffMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_RESOLVE_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private static void createDirectories(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create directory " + directory, e);
        }
    }

    public List<UploaderStatus> statuses() {
        return uploaders.stream().map(FileUploader::status).toList();
    }

    public List<FileUploader> getUploaders() {
        return Collections.unmodifiableList(uploaders);
    }

    public ConnectorConfig getConfig() {
        return config;
    }
}
