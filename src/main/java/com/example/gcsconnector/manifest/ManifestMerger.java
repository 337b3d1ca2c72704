package com.example.gcsconnector.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Appends uploaded file names to a list nested somewhere inside a JSON document.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManifestMerger {

    private final ObjectMapper objectMapper;

    /**
     * Merges {@code names} into the array at {@code fieldPath} (dot separated).
     * Missing objects along the path are created. The template is left untouched.
     *
     * @param template  document to start from, may be null
     * @param fieldPath e.g. {@code data.files}
     * @param names     bare file names, appended in order
     * @return a new document
     */
    public ObjectNode merge(ObjectNode template, String fieldPath, List<String> names) {
        ObjectNode root = template == null ? objectMapper.createObjectNode() : template.deepCopy();
        String[] segments = fieldPath.split("\\.");

        ObjectNode node = root;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = node.get(segments[i]);
            if (child == null || !child.isObject()) {
                if (child != null) {
                    log.warn("Manifest field '{}' is not an object, replacing it", segments[i]);
                }
                child = node.putObject(segments[i]);
            }
            node = (ObjectNode) child;
        }

        String leaf = segments[segments.length - 1];
        JsonNode existing = node.get(leaf);
        ArrayNode files;
        if (existing != null && existing.isArray()) {
            files = (ArrayNode) existing;
        } else {
            if (existing != null) {
                log.warn("Manifest field '{}' is not a list, replacing it", fieldPath);
            }
            files = node.putArray(leaf);
        }
        names.forEach(files::add);
        return root;
    }

    public byte[] serialize(ObjectNode document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize manifest", e);
        }
    }

    /**
     * Parses a manifest document. Anything but a JSON object is rejected.
     */
    public ObjectNode parse(byte[] content) throws IOException {
        JsonNode node = objectMapper.readTree(content);
        if (node == null || !node.isObject()) {
            throw new IOException("Manifest is not a JSON object");
        }
        return (ObjectNode) node;
    }
}
