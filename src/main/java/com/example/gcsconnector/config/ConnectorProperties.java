package com.example.gcsconnector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "connector")
public class ConnectorProperties {

    /**
     * Output locators, e.g. gs://bucket/path/video_%Y-%m-%d.mp4!segtime=1
     */
    private List<String> outputs = new ArrayList<>();

    /**
     * Upstream source bindings. Only checked for presence.
     */
    private List<String> sources = new ArrayList<>();

    private String workdir;

    /**
     * Seconds after which a file that keeps failing is abandoned. Null means never.
     */
    private Double timeout;

    private String manifest;

    private String manifestField;

    private String imageDirectory;

    private Duration pollInterval = Duration.ofSeconds(5);

    private Duration settleTime = Duration.ofSeconds(10);

    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private Storage storage = new Storage();

    @Data
    public static class Storage {

        private String endpoint = "https://storage.googleapis.com";

        private String accessKey;

        private String secretKey;

        private String region;

        private boolean createMissingBuckets = false;

        private int resolveAttempts = 3;

        private Duration resolveBackoff = Duration.ofSeconds(2);
    }
}
