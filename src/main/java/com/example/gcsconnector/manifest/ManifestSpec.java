package com.example.gcsconnector.manifest;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where the manifest template comes from, which field collects uploaded names, and the
 * template as loaded at startup (null when there was nothing to load).
 */
public record ManifestSpec(String source, String fieldPath, ObjectNode template) {

    static final String GS_SCHEME = "gs://";
    static final String FILE_SCHEME = "file://";

    public boolean isRemote() {
        return source.startsWith(GS_SCHEME);
    }

    public String bucket() {
        String rest = source.substring(GS_SCHEME.length());
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }

    public String key() {
        String rest = source.substring(GS_SCHEME.length());
        int slash = rest.indexOf('/');
        return slash < 0 ? "" : rest.substring(slash + 1);
    }

    public Path localPath() {
        return Paths.get(source.startsWith(FILE_SCHEME) ? source.substring(FILE_SCHEME.length()) : source);
    }

    public String fileName() {
        return source.substring(source.lastIndexOf('/') + 1);
    }

    public ManifestSpec withTemplate(ObjectNode template) {
        return new ManifestSpec(source, fieldPath, template);
    }
}
