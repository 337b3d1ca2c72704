package com.example.gcsconnector.model;

import lombok.Builder;

import java.time.Instant;

@Builder
public record UploaderStatus(
        String name,
        String kind,
        String directory,
        String bucket,
        String blobPath,
        int queued,
        long uploaded,
        long failedAttempts,
        long abandoned,
        Instant lastCycle,
        boolean running) {
}
