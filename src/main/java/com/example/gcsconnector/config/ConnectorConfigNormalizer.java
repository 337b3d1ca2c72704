package com.example.gcsconnector.config;

import com.example.gcsconnector.exception.ConfigurationException;
import com.example.gcsconnector.model.ConnectorConfig;
import com.example.gcsconnector.model.UploadTarget;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the raw {@link ConnectorProperties} into a {@link ConnectorConfig}, failing fast on
 * anything that would stop an uploader from working.
 */
public final class ConnectorConfigNormalizer {

    public static final String DEFAULT_WORKDIR = "workdir";
    public static final String DEFAULT_MANIFEST_FIELD = "files";
    public static final String SEGTIME_OPTION = "segtime";

    private ConnectorConfigNormalizer() {
    }

    public static ConnectorConfig normalize(ConnectorProperties properties) {
        List<String> outputs = nonBlank(properties.getOutputs());
        if (outputs.isEmpty()) {
            throw new ConfigurationException("must specify at least one output");
        }
        List<String> sources = nonBlank(properties.getSources());
        if (sources.isEmpty()) {
            throw new ConfigurationException("must specify at least one source");
        }

        Duration timeout = toTimeout(properties.getTimeout());
        List<UploadTarget> targets = new ArrayList<>();
        for (String output : outputs) {
            targets.add(parseOutput(output, properties.getPollInterval(), timeout));
        }

        String manifest = StringUtils.hasText(properties.getManifest()) ? properties.getManifest().trim() : null;
        String manifestField = null;
        if (manifest != null) {
            manifestField = StringUtils.hasText(properties.getManifestField())
                    ? properties.getManifestField().trim()
                    : DEFAULT_MANIFEST_FIELD;
            validateFieldPath(manifestField);
        }

        Path workdir = Paths.get(StringUtils.hasText(properties.getWorkdir())
                ? properties.getWorkdir()
                : DEFAULT_WORKDIR);
        Path imageDirectory = StringUtils.hasText(properties.getImageDirectory())
                ? Paths.get(properties.getImageDirectory())
                : null;

        return new ConnectorConfig(
                Collections.unmodifiableList(targets),
                sources,
                workdir,
                timeout,
                manifest,
                manifestField,
                imageDirectory,
                properties.getSettleTime(),
                properties.getShutdownTimeout());
    }

    /**
     * Parses {@code gs://bucket/path/file[!option...]}.
     */
    public static UploadTarget parseOutput(String output, Duration defaultInterval, Duration timeout) {
        String trimmed = output.trim();
        if (!trimmed.startsWith(UploadTarget.SCHEME)) {
            throw new ConfigurationException("can only specify gs:// outputs, not '" + output + "'");
        }

        String[] parts = trimmed.split("!");
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                continue;
            }
            int eq = parts[i].indexOf('=');
            if (eq < 0) {
                options.put(parts[i], "");
            } else {
                options.put(parts[i].substring(0, eq), parts[i].substring(eq + 1));
            }
        }

        String rest = parts[0].substring(UploadTarget.SCHEME.length());
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1 || rest.endsWith("/")) {
            throw new ConfigurationException("output must have both bucket and a path/file name: '" + output + "'");
        }
        String bucket = rest.substring(0, slash);
        String path = rest.substring(slash + 1);
        int lastSlash = path.lastIndexOf('/');
        String blobPath = lastSlash < 0 ? "" : path.substring(0, lastSlash);
        String filename = path.substring(lastSlash + 1);

        return new UploadTarget(
                trimmed,
                bucket,
                blobPath,
                filename,
                prefixOf(filename),
                intervalOf(options, defaultInterval, output),
                timeout,
                Collections.unmodifiableMap(options));
    }

    static String prefixOf(String filename) {
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        int placeholder = stem.indexOf('%');
        return placeholder < 0 ? stem : stem.substring(0, placeholder);
    }

    private static Duration intervalOf(Map<String, String> options, Duration defaultInterval, String output) {
        String segtime = options.get(SEGTIME_OPTION);
        if (segtime == null) {
            return defaultInterval;
        }
        double minutes;
        try {
            minutes = Double.parseDouble(segtime);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("invalid segtime '" + segtime + "' in output '" + output + "'", e);
        }
        if (!(minutes > 0)) {
            throw new ConfigurationException("segtime must be positive in output '" + output + "'");
        }
        return Duration.ofMillis(Math.max(1, Math.round(minutes * 60_000)));
    }

    private static Duration toTimeout(Double seconds) {
        if (seconds == null) {
            return null;
        }
        if (seconds < 0 || seconds.isNaN()) {
            throw new ConfigurationException("timeout must not be negative: " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private static void validateFieldPath(String fieldPath) {
        for (String segment : fieldPath.split("\\.", -1)) {
            if (segment.isBlank()) {
                throw new ConfigurationException("invalid manifest field '" + fieldPath + "'");
            }
        }
    }

    private static List<String> nonBlank(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (StringUtils.hasText(value)) {
                    result.add(value.trim());
                }
            }
        }
        return result;
    }
}
