package com.example.gcsconnector.worker;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Uploads every file dropped into a watched directory. Writers mark files they are still
 * working on with a {@code <name>.lock} sidecar; the uploader claims a file by creating that
 * marker itself and removes it once the attempt is over.
 */
@Slf4j
public class DirectoryUploader extends FileUploader {

    public static final String LOCK_SUFFIX = ".lock";

    public DirectoryUploader(UploaderContext context) {
        super(context);
    }

    @Override
    protected List<Path> selectCandidates() throws IOException {
        if (!Files.isDirectory(context.directory())) {
            log.debug("Watched directory {} does not exist", context.directory());
            return List.of();
        }
        try (Stream<Path> files = Files.list(context.directory())) {
            return files
                    .filter(path -> !path.getFileName().toString().endsWith(LOCK_SUFFIX))
                    .filter(Files::isRegularFile)
                    .filter(path -> !Files.exists(lockOf(path)))
                    .filter(path -> !isRetired(path))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    protected boolean claim(Path file) {
        try {
            Files.createFile(lockOf(file));
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            log.warn("Could not lock {}", file, e);
            return false;
        }
    }

    @Override
    protected void release(Path file) {
        try {
            Files.deleteIfExists(lockOf(file));
        } catch (IOException e) {
            log.warn("Could not remove lock of {}", file, e);
        }
    }

    static Path lockOf(Path file) {
        return file.resolveSibling(file.getFileName() + LOCK_SUFFIX);
    }

    @Override
    protected String kind() {
        return "directory";
    }

    @Override
    protected int queued() {
        return 0;
    }
}
