package com.example.gcsconnector.worker;

import com.example.gcsconnector.manifest.ManifestPublisher;
import com.example.gcsconnector.storage.BucketHandle;
import com.example.gcsconnector.storage.StorageClient;
import lombok.Builder;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * What every uploader needs regardless of how it finds its files.
 *
 * @param timeout           null disables abandonment
 * @param manifestPublisher null when no manifest is configured
 */
@Builder
public record UploaderContext(
        String name,
        StorageClient storageClient,
        BucketHandle bucket,
        String blobPath,
        Path directory,
        Duration interval,
        Duration timeout,
        ManifestPublisher manifestPublisher,
        Clock clock) {

    public UploaderContext {
        blobPath = blobPath == null ? "" : blobPath;
        directory = directory.toAbsolutePath().normalize();
        clock = clock == null ? Clock.systemUTC() : clock;
    }
}
