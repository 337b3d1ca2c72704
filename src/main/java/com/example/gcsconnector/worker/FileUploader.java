package com.example.gcsconnector.worker;

import com.example.gcsconnector.manifest.ManifestPublisher;
import com.example.gcsconnector.model.CycleReport;
import com.example.gcsconnector.model.UploadOutcome;
import com.example.gcsconnector.model.UploaderStatus;
import com.example.gcsconnector.storage.BlobHandle;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Poll loop shared by the uploaders: pick candidate files, upload each one, delete it locally,
 * then publish the manifest if anything went out. Subclasses decide which files are candidates
 * and how a file is claimed and released.
 * <p>
 * Everything except the counters is confined to the thread running {@link #run}.
 */
@Slf4j
public abstract class FileUploader {

    protected final UploaderContext context;

    private final Map<Path, Instant> eligibleSince = new HashMap<>();
    // last-modified time at retirement, null if it could not be read
    private final Map<Path, FileTime> retired = new HashMap<>();

    private final AtomicLong uploaded = new AtomicLong();
    private final AtomicLong failedAttempts = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();
    private volatile Instant lastCycle;
    private volatile boolean running;

    protected FileUploader(UploaderContext context) {
        this.context = context;
    }

    /**
     * Files to try this cycle, in upload order.
     */
    protected abstract List<Path> selectCandidates() throws IOException;

    /**
     * @return false if the file must not be touched this cycle
     */
    protected boolean claim(Path file) {
        return true;
    }

    /**
     * Called after every attempt on a file that was claimed.
     */
    protected void release(Path file) {
    }

    /**
     * The file is done with, successfully or not. Drop any bookkeeping about it.
     */
    protected void forget(Path file) {
    }

    protected abstract String kind();

    protected abstract int queued();

    public void run(CancellationToken cancellation) {
        log.info("Uploader {} started: {} -> gs://{}/{} every {}", context.name(), context.directory(),
                context.bucket().name(), context.blobPath(), context.interval());
        running = true;
        try {
            while (!cancellation.isCancelled()) {
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    log.error("Upload cycle of {} failed", context.name(), e);
                }
                if (cancellation.await(context.interval())) {
                    break;
                }
            }
        } catch (Error e) {
            log.error("Uploader {} died, no more files will be uploaded from {}", context.name(),
                    context.directory(), e);
            throw e;
        } finally {
            running = false;
        }
        log.info("Uploader {} stopped", context.name());
    }

    public CycleReport runCycle() {
        retired.entrySet().removeIf(entry -> !stillRetired(entry.getKey(), entry.getValue()));

        List<Path> candidates;
        try {
            candidates = selectCandidates();
            eligibleSince.keySet().retainAll(candidates);
        } catch (IOException e) {
            log.warn("Failed to scan {}", context.directory(), e);
            candidates = List.of();
        }

        Map<Path, UploadOutcome> outcomes = new LinkedHashMap<>();
        List<String> uploadedNames = new ArrayList<>();
        for (Path file : candidates) {
            UploadOutcome outcome = uploadOne(file);
            outcomes.put(file, outcome);
            if (outcome == UploadOutcome.UPLOADED) {
                uploadedNames.add(file.getFileName().toString());
            }
        }

        ManifestPublisher manifestPublisher = context.manifestPublisher();
        boolean published = manifestPublisher != null && manifestPublisher.publish(uploadedNames);

        lastCycle = context.clock().instant();
        if (!uploadedNames.isEmpty()) {
            log.info("{} uploaded {} of {} file(s)", context.name(), uploadedNames.size(), candidates.size());
        }
        return new CycleReport(outcomes, uploadedNames, published);
    }

    private UploadOutcome uploadOne(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("{} is gone, nothing to upload", file);
            done(file);
            return UploadOutcome.SKIPPED;
        }
        if (!claim(file)) {
            log.debug("{} is locked, skipping", file);
            return UploadOutcome.SKIPPED;
        }
        try {
            Instant since = eligibleSince.computeIfAbsent(file, f -> context.clock().instant());
            BlobHandle blob = context.storageClient().blob(context.bucket(), blobKey(file));
            try {
                context.storageClient().uploadFile(blob, file);
            } catch (RuntimeException e) {
                if (!Files.exists(file)) {
                    log.debug("{} disappeared during upload, treating it as handled", file);
                    done(file);
                    return UploadOutcome.SKIPPED;
                }
                return failed(file, since, e);
            }

            uploaded.incrementAndGet();
            done(file);
            try {
                Files.deleteIfExists(file);
                log.info("Uploaded {} to {}", file, blob);
            } catch (IOException e) {
                log.warn("Uploaded {} to {} but could not delete it, it will not be uploaded again", file, blob, e);
                retire(file);
            }
            return UploadOutcome.UPLOADED;
        } finally {
            release(file);
        }
    }

    private UploadOutcome failed(Path file, Instant since, RuntimeException e) {
        failedAttempts.incrementAndGet();
        Duration age = Duration.between(since, context.clock().instant());
        Duration timeout = context.timeout();
        if (timeout != null && age.compareTo(timeout) > 0) {
            abandoned.incrementAndGet();
            retire(file);
            done(file);
            log.error("Giving up on {} after {} of failed uploads, leaving it on disk", file, age, e);
            return UploadOutcome.ABANDONED;
        }
        log.warn("Failed to upload {}, will retry: {}", file, e.getMessage());
        return UploadOutcome.FAILED;
    }

    private void done(Path file) {
        eligibleSince.remove(file);
        forget(file);
    }

    private void retire(Path file) {
        retired.put(file, lastModified(file));
    }

    /**
     * True while a file given up on is still on disk unchanged. A file replaced under the
     * same name counts as new.
     */
    protected boolean isRetired(Path file) {
        return retired.containsKey(file) && stillRetired(file, retired.get(file));
    }

    private static boolean stillRetired(Path file, FileTime retiredAt) {
        FileTime current = lastModified(file);
        return current != null && (retiredAt == null || retiredAt.equals(current));
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return null;
        }
    }

    int trackedFiles() {
        return eligibleSince.size() + retired.size();
    }

    protected String blobKey(Path file) {
        String filename = file.getFileName().toString();
        return context.blobPath().isEmpty() ? filename : context.blobPath() + "/" + filename;
    }

    public UploaderStatus status() {
        return UploaderStatus.builder()
                .name(context.name())
                .kind(kind())
                .directory(context.directory().toString())
                .bucket(context.bucket().name())
                .blobPath(context.blobPath())
                .queued(queued())
                .uploaded(uploaded.get())
                .failedAttempts(failedAttempts.get())
                .abandoned(abandoned.get())
                .lastCycle(lastCycle)
                .running(running)
                .build();
    }

    public UploaderContext getContext() {
        return context;
    }
}
