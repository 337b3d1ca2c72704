package com.example.gcsconnector.worker;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Uploads the segment files of one output. Closed segments arrive through {@link #enqueue};
 * each cycle also sweeps the work directory for files with the output's prefix that have not
 * been modified for the settle time, which picks up whatever a previous run left behind.
 */
@Slf4j
public class SegmentUploader extends FileUploader {

    private final String prefix;
    private final Duration settleTime;

    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
    private final Set<Path> pending = new LinkedHashSet<>();
    private volatile int pendingCount;

    public SegmentUploader(UploaderContext context, String prefix, Duration settleTime) {
        super(context);
        this.prefix = prefix;
        this.settleTime = settleTime;
    }

    /**
     * Hands over a closed segment. Safe to call from any thread.
     */
    public void enqueue(Path segment) {
        queue.offer(segment.toAbsolutePath().normalize());
    }

    @Override
    protected List<Path> selectCandidates() throws IOException {
        List<Path> drained = new ArrayList<>();
        queue.drainTo(drained);
        for (Path path : drained) {
            if (!isRetired(path)) {
                pending.add(path);
            }
        }

        if (Files.isDirectory(context.directory())) {
            Instant settledBefore = context.clock().instant().minus(settleTime);
            List<Path> swept;
            try (Stream<Path> files = Files.list(context.directory())) {
                swept = files
                        .filter(this::matchesPrefix)
                        .filter(Files::isRegularFile)
                        .filter(path -> !pending.contains(path) && !isRetired(path))
                        .filter(path -> isSettled(path, settledBefore))
                        .sorted()
                        .collect(Collectors.toList());
            }
            if (!swept.isEmpty()) {
                log.debug("Found {} settled segment(s) in {}", swept.size(), context.directory());
            }
            pending.addAll(swept);
        }

        pendingCount = pending.size();
        return new ArrayList<>(pending);
    }

    @Override
    protected void forget(Path file) {
        pending.remove(file);
        pendingCount = pending.size();
    }

    private boolean matchesPrefix(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(prefix) && !name.endsWith(DirectoryUploader.LOCK_SUFFIX);
    }

    private boolean isSettled(Path path, Instant settledBefore) {
        try {
            return !Files.getLastModifiedTime(path).toInstant().isAfter(settledBefore);
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    protected String kind() {
        return "segment";
    }

    @Override
    protected int queued() {
        return queue.size() + pendingCount;
    }

    public String getPrefix() {
        return prefix;
    }
}
