package com.example.gcsconnector.storage;

import com.example.gcsconnector.exception.StorageException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The few object-storage operations the uploaders need. Every method may throw
 * {@link StorageException}.
 */
public interface StorageClient {

    /**
     * Looks the bucket up. Fails if it does not exist and cannot be created.
     */
    BucketHandle resolveBucket(String name);

    /**
     * Reads a whole object, empty if there is no object at that key.
     */
    Optional<byte[]> getBlob(BucketHandle bucket, String key);

    /**
     * Addresses an object. Does no I/O, the object is created by the first upload.
     */
    default BlobHandle blob(BucketHandle bucket, String key) {
        return new BlobHandle(bucket, key);
    }

    void uploadFile(BlobHandle blob, Path localPath);

    void uploadBytes(BlobHandle blob, byte[] content, String contentType);
}
