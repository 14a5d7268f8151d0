package com.ospicorp.anomalyapi.config;

import com.ospicorp.anomalyapi.storage.FilesystemStorageBackend;
import com.ospicorp.anomalyapi.storage.S3StorageBackend;
import com.ospicorp.anomalyapi.storage.StorageBackend;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * Selects the storage backend from {@code anomaly.storage.type}: {@code filesystem} (default)
 * or {@code s3}.
 */
@Configuration
public class StorageConfig {

  private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

  @Bean
  @ConditionalOnProperty(name = "anomaly.storage.type", havingValue = "filesystem",
      matchIfMissing = true)
  StorageBackend filesystemStorageBackend(
      @Value("${anomaly.storage.root:./models}") String root) {
    FilesystemStorageBackend backend = new FilesystemStorageBackend(Path.of(root));
    log.info("Model storage: filesystem at {}", backend.root());
    return backend;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "anomaly.storage.type", havingValue = "s3")
  S3Client s3Client(
      @Value("${anomaly.storage.s3.region:us-east-1}") String region,
      @Value("${anomaly.storage.s3.endpoint:}") String endpoint,
      @Value("${anomaly.storage.s3.path-style-access:false}") boolean pathStyleAccess,
      @Value("${anomaly.storage.s3.access-key:}") String accessKey,
      @Value("${anomaly.storage.s3.secret-key:}") String secretKey,
      @Value("${anomaly.storage.s3.api-call-timeout-ms:10000}") long apiCallTimeoutMs) {
    // retries belong to the model store, so the SDK must not retry underneath it
    S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(region))
        .credentialsProvider(credentials(accessKey, secretKey))
        .forcePathStyle(pathStyleAccess)
        .overrideConfiguration(ClientOverrideConfiguration.builder()
            .retryPolicy(RetryPolicy.none())
            .apiCallTimeout(Duration.ofMillis(apiCallTimeoutMs))
            .build());
    if (!endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint));
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnProperty(name = "anomaly.storage.type", havingValue = "s3")
  StorageBackend s3StorageBackend(S3Client s3Client,
      @Value("${anomaly.storage.s3.bucket}") String bucket,
      @Value("${anomaly.storage.s3.prefix:models}") String prefix) {
    log.info("Model storage: s3://{}/{}", bucket, prefix);
    return new S3StorageBackend(s3Client, bucket, prefix);
  }

  private static AwsCredentialsProvider credentials(String accessKey, String secretKey) {
    if (accessKey.isBlank() || secretKey.isBlank()) {
      return DefaultCredentialsProvider.create();
    }
    return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
  }
}
