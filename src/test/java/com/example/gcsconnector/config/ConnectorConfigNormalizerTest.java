package com.example.gcsconnector.config;

import com.example.gcsconnector.exception.ConfigurationException;
import com.example.gcsconnector.model.ConnectorConfig;
import com.example.gcsconnector.model.UploadTarget;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectorConfigNormalizerTest {

    private static ConnectorProperties properties(String... outputs) {
        ConnectorProperties properties = new ConnectorProperties();
        properties.setOutputs(List.of(outputs));
        properties.setSources(List.of("tcp://127.0.0.1:5550"));
        return properties;
    }

    @Test
    void normalize_NoOutputs() {
        ConnectorProperties properties = properties();

        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> ConnectorConfigNormalizer.normalize(properties));

        assertEquals("must specify at least one output", exception.getMessage());
    }

    @Test
    void normalize_BlankOutputsCountAsMissing() {
        ConnectorProperties properties = properties("", "  ");

        assertThrows(ConfigurationException.class, () -> ConnectorConfigNormalizer.normalize(properties));
    }

    @Test
    void normalize_NoSources() {
        ConnectorProperties properties = properties("gs://test-bucket/test.mp4");
        properties.setSources(List.of());

        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> ConnectorConfigNormalizer.normalize(properties));

        assertEquals("must specify at least one source", exception.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"file://localfile", "http://bucket/path/file.mp4", "s3://bucket/path/file.mp4"})
    void normalize_RejectsOtherSchemes(String output) {
        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> ConnectorConfigNormalizer.normalize(properties(output)));

        assertTrue(exception.getMessage().startsWith("can only specify gs:// outputs"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"gs://my-bucket", "gs://", "gs://my-bucket/", "gs:///path/file.mp4", "gs://bucket/path/"})
    void normalize_RequiresBucketAndPath(String output) {
        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> ConnectorConfigNormalizer.normalize(properties(output)));

        assertTrue(exception.getMessage().startsWith("output must have both bucket and a path/file name"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "gs://bucket/path/file.mp4",
            "gs://my-bucket/subfolder/video_%Y-%m-%d.mp4",
            "gs://bucket-with-dashes/path/file.mp4",
            "gs://bucket.with.dots/path/file.mp4",
            "gs://test-bucket/test.mp4"
    })
    void normalize_AcceptsValidOutputs(String output) {
        ConnectorConfig config = ConnectorConfigNormalizer.normalize(properties(output));

        assertEquals(1, config.outputs().size());
        assertEquals(output, config.outputs().get(0).output());
        assertTrue(config.outputs().get(0).output().startsWith("gs://"));
    }

    @Test
    void normalize_Defaults() {
        ConnectorConfig config = ConnectorConfigNormalizer.normalize(properties("gs://test-bucket/test.mp4"));

        assertEquals(Paths.get("workdir"), config.workdir());
        assertNull(config.timeout());
        assertNull(config.manifest());
        assertNull(config.manifestField());
        assertNull(config.imageDirectory());
        assertFalse(config.hasManifest());
        assertEquals(Duration.ofSeconds(5), config.outputs().get(0).interval());
    }

    @Test
    void normalize_ExplicitValues() {
        ConnectorProperties properties = properties("gs://my-bucket/path/video_%Y-%m-%d.mp4");
        properties.setWorkdir("/custom/work/directory");
        properties.setTimeout(60.5);
        properties.setManifest("file://my_manifest.json");
        properties.setManifestField("my.custom.files");
        properties.setImageDirectory("/path/to/images");

        ConnectorConfig config = ConnectorConfigNormalizer.normalize(properties);

        assertEquals(Paths.get("/custom/work/directory"), config.workdir());
        assertEquals(Duration.ofMillis(60500), config.timeout());
        assertEquals(Duration.ofMillis(60500), config.outputs().get(0).timeout());
        assertEquals("file://my_manifest.json", config.manifest());
        assertEquals("my.custom.files", config.manifestField());
        assertEquals(Paths.get("/path/to/images"), config.imageDirectory());
    }

    @Test
    void normalize_BlankOptionalValuesAreAbsent() {
        ConnectorProperties properties = properties("gs://test-bucket/test.mp4");
        properties.setWorkdir("");
        properties.setManifest("");
        properties.setManifestField("");
        properties.setImageDirectory(" ");

        ConnectorConfig config = ConnectorConfigNormalizer.normalize(properties);

        assertEquals(Paths.get(ConnectorConfigNormalizer.DEFAULT_WORKDIR), config.workdir());
        assertNull(config.manifest());
        assertNull(config.manifestField());
        assertNull(config.imageDirectory());
    }

    @Test
    void normalize_ManifestFieldDefaultsToFiles() {
        ConnectorProperties properties = properties("gs://test-bucket/test.mp4");
        properties.setManifest("gs://test-bucket/manifest_template.json");

        ConnectorConfig config = ConnectorConfigNormalizer.normalize(properties);

        assertEquals("files", config.manifestField());
    }

    @Test
    void normalize_RejectsEmptyManifestFieldSegment() {
        ConnectorProperties properties = properties("gs://test-bucket/test.mp4");
        properties.setManifest("file://manifest.json");
        properties.setManifestField("data..files");

        assertThrows(ConfigurationException.class, () -> ConnectorConfigNormalizer.normalize(properties));
    }

    @Test
    void normalize_RejectsNegativeTimeout() {
        ConnectorProperties properties = properties("gs://test-bucket/test.mp4");
        properties.setTimeout(-1.0);

        assertThrows(ConfigurationException.class, () -> ConnectorConfigNormalizer.normalize(properties));
    }

    @Test
    void normalize_MultipleOutputs() {
        ConnectorConfig config = ConnectorConfigNormalizer.normalize(
                properties("gs://bucket1/path1/video1.mp4", "gs://bucket2/path2/video2.mp4"));

        assertEquals(2, config.outputs().size());
        assertEquals("bucket1", config.outputs().get(0).bucket());
        assertEquals("bucket2", config.outputs().get(1).bucket());
    }

    @Test
    void parseOutput_SplitsLocator() {
        UploadTarget target = ConnectorConfigNormalizer.parseOutput(
                "gs://my-bucket/some/path/video_%Y-%m-%d_%H-%M-%S.mp4!segtime=0.5!fps=10",
                Duration.ofSeconds(5), null);

        assertEquals("my-bucket", target.bucket());
        assertEquals("some/path", target.blobPath());
        assertEquals("video_%Y-%m-%d_%H-%M-%S.mp4", target.filenameTemplate());
        assertEquals("video_", target.prefix());
        assertEquals(Duration.ofSeconds(30), target.interval());
        assertEquals("10", target.options().get("fps"));
        assertEquals("gs://my-bucket/some/path/video_%Y-%m-%d_%H-%M-%S.mp4", target.location());
        assertEquals("some/path/video_0001.mp4", target.blobKey("video_0001.mp4"));
    }

    @Test
    void parseOutput_FileAtBucketRoot() {
        UploadTarget target = ConnectorConfigNormalizer.parseOutput("gs://my-bucket/video_123.mp4",
                Duration.ofSeconds(5), null);

        assertEquals("", target.blobPath());
        assertEquals("video_123", target.prefix());
        assertEquals("video_123_0001.mp4", target.blobKey("video_123_0001.mp4"));
    }

    @Test
    void parseOutput_RejectsBadSegtime() {
        assertThrows(ConfigurationException.class, () -> ConnectorConfigNormalizer.parseOutput(
                "gs://my-bucket/path/video.mp4!segtime=soon", Duration.ofSeconds(5), null));
        assertThrows(ConfigurationException.class, () -> ConnectorConfigNormalizer.parseOutput(
                "gs://my-bucket/path/video.mp4!segtime=0", Duration.ofSeconds(5), null));
    }

    @Test
    void prefixOf_StopsAtFirstPlaceholder() {
        assertEquals("video_123", ConnectorConfigNormalizer.prefixOf("video_123.mp4"));
        assertEquals("test_video_", ConnectorConfigNormalizer.prefixOf("test_video_%Y-%m-%d.mp4"));
        assertEquals("noext", ConnectorConfigNormalizer.prefixOf("noext"));
    }
}
