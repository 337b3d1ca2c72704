package com.example.gcsconnector.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Validated connector settings. Produced once at startup from the bound properties.
 */
public record ConnectorConfig(
        List<UploadTarget> outputs,
        List<String> sources,
        Path workdir,
        Duration timeout,
        String manifest,
        String manifestField,
        Path imageDirectory,
        Duration settleTime,
        Duration shutdownTimeout) {

    public boolean hasManifest() {
        return manifest != null;
    }
}
