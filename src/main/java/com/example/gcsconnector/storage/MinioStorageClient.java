package com.example.gcsconnector.storage;

import com.example.gcsconnector.config.ConnectorProperties;
import com.example.gcsconnector.exception.StorageException;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.UploadObjectArgs;
import io.minio.errors.ErrorResponseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class MinioStorageClient implements StorageClient {

    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final MinioClient minioClient;
    private final ConnectorProperties properties;

    @Override
    public BucketHandle resolveBucket(String name) {
        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(name).build());
            if (!found) {
                if (!properties.getStorage().isCreateMissingBuckets()) {
                    throw new StorageException("Bucket does not exist: " + name, null);
                }
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(name).build());
                log.info("Created bucket: {}", name);
            } else {
                log.debug("Bucket exists: {}", name);
            }
            return new BucketHandle(name);
        } catch (StorageException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageException("Failed to resolve bucket " + name, e);
        }
    }

    @Override
    public Optional<byte[]> getBlob(BucketHandle bucket, String key) {
        try (GetObjectResponse response = minioClient.getObject(
                GetObjectArgs.builder()
                        .bucket(bucket.name())
                        .object(key)
                        .build())) {
            return Optional.of(response.readAllBytes());
        } catch (ErrorResponseException e) {
            if (e.errorResponse() != null && NO_SUCH_KEY.equals(e.errorResponse().code())) {
                return Optional.empty();
            }
            throw new StorageException("Failed to read gs://" + bucket.name() + "/" + key, e);
        } catch (Exception e) {
            throw new StorageException("Failed to read gs://" + bucket.name() + "/" + key, e);
        }
    }

    @Override
    public void uploadFile(BlobHandle blob, Path localPath) {
        try {
            minioClient.uploadObject(
                    UploadObjectArgs.builder()
                            .bucket(blob.bucket().name())
                            .object(blob.key())
                            .filename(localPath.toString())
                            .contentType(contentTypeOf(localPath))
                            .build());
            log.debug("Uploaded {} to {}", localPath, blob);
        } catch (Exception e) {
            throw new StorageException("Failed to upload " + localPath + " to " + blob, e);
        }
    }

    @Override
    public void uploadBytes(BlobHandle blob, byte[] content, String contentType) {
        try {
            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(blob.bucket().name())
                            .object(blob.key())
                            .stream(new ByteArrayInputStream(content), content.length, -1)
                            .contentType(contentType)
                            .build());
            log.debug("Uploaded {} bytes to {}", content.length, blob);
        } catch (Exception e) {
            throw new StorageException("Failed to upload " + content.length + " bytes to " + blob, e);
        }
    }

    static String contentTypeOf(Path path) {
        return MediaTypeFactory.getMediaType(path.getFileName().toString())
                .orElse(MediaType.APPLICATION_OCTET_STREAM)
                .toString();
    }
}
