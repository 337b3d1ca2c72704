package com.example.gcsconnector.config;

import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Builds the MinIO client against the Cloud Storage XML API. GCS accepts S3-style
 * requests signed with HMAC keys, so the bucket and key layout is the same as gs://.
 */
@Configuration
@Slf4j
public class StorageConfig {

  @Bean
  public MinioClient minioClient(ConnectorProperties properties) {
    ConnectorProperties.Storage storage = properties.getStorage();

    MinioClient.Builder builder = MinioClient.builder().endpoint(storage.getEndpoint());
    if (StringUtils.hasText(storage.getAccessKey())) {
      builder.credentials(storage.getAccessKey(), storage.getSecretKey());
    } else {
      log.warn("No storage credentials configured, requests to {} will be anonymous", storage.getEndpoint());
    }
    if (StringUtils.hasText(storage.getRegion())) {
      builder.region(storage.getRegion());
    }

    log.info("Configured object storage client for endpoint {}", storage.getEndpoint());
    return builder.build();
  }
}
