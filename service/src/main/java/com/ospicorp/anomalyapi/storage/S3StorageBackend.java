package com.ospicorp.anomalyapi.storage;

import com.ospicorp.anomalyapi.error.AnomalyDetectionException;
import com.ospicorp.anomalyapi.error.ModelNotFoundException;
import com.ospicorp.anomalyapi.error.StorageIntegrityException;
import com.ospicorp.anomalyapi.error.StorageReadException;
import com.ospicorp.anomalyapi.error.StorageWriteException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Stores each version as the object {@code {prefix}/{seriesId}/v{N}.model}. Every write is a
 * single PutObject, which S3 makes visible atomically. The client is expected to run with SDK
 * retries disabled; the model store owns retries.
 */
public class S3StorageBackend implements StorageBackend {

  private static final Logger log = LoggerFactory.getLogger(S3StorageBackend.class);

  private static final String CONTENT_TYPE = "application/json";

  private final S3Client s3;
  private final String bucket;
  private final String prefix;

  public S3StorageBackend(S3Client s3, String bucket, String prefix) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must be provided");
    }
    this.s3 = s3;
    this.bucket = bucket;
    this.prefix = normalizePrefix(prefix);
  }

  @Override
  public String name() {
    return "s3";
  }

  public String key(StorageLocator locator) {
    return prefix + locator.relativePath();
  }

  @Override
  public StorageResult<Void> put(StorageLocator locator, byte[] data) {
    String key = key(locator);
    try {
      // best effort: two processes writing the same key between head and put both succeed
      if (objectExists(key)) {
        return StorageResult.permanentFailure(
            new StorageIntegrityException("Object s3://" + bucket + "/" + key + " already exists"));
      }
      s3.putObject(PutObjectRequest.builder()
          .bucket(bucket)
          .key(key)
          .contentType(CONTENT_TYPE)
          .contentLength((long) data.length)
          .build(), RequestBody.fromBytes(data));
      log.debug("Uploaded {} bytes to s3://{}/{}", data.length, bucket, key);
      return StorageResult.ok();
    } catch (SdkException ex) {
      return failure(ex, true, "write s3://" + bucket + "/" + key);
    }
  }

  @Override
  public StorageResult<byte[]> get(StorageLocator locator) {
    String key = key(locator);
    try {
      byte[] data = s3.getObjectAsBytes(GetObjectRequest.builder()
          .bucket(bucket)
          .key(key)
          .build()).asByteArray();
      return StorageResult.ok(data);
    } catch (NoSuchKeyException ex) {
      return StorageResult.notFound(
          new ModelNotFoundException(locator.seriesId(), locator.version()));
    } catch (S3Exception ex) {
      if (ex.statusCode() == 404) {
        return StorageResult.notFound(
            new ModelNotFoundException(locator.seriesId(), locator.version()));
      }
      return failure(ex, false, "read s3://" + bucket + "/" + key);
    } catch (SdkException ex) {
      return failure(ex, false, "read s3://" + bucket + "/" + key);
    }
  }

  @Override
  public StorageResult<List<Integer>> listVersions(String seriesId) {
    String seriesPrefix = prefix + seriesId + "/";
    List<Integer> versions = new ArrayList<>();
    try {
      ListObjectsV2Request request = ListObjectsV2Request.builder()
          .bucket(bucket)
          .prefix(seriesPrefix)
          .build();
      for (S3Object object : s3.listObjectsV2Paginator(request).contents()) {
        String name = object.key().substring(seriesPrefix.length());
        OptionalInt version = StorageLocator.parseVersion(name);
        if (version.isPresent()) {
          versions.add(version.getAsInt());
        }
      }
    } catch (SdkException ex) {
      return failure(ex, false, "list s3://" + bucket + "/" + seriesPrefix);
    }
    Collections.sort(versions);
    return StorageResult.ok(List.copyOf(versions));
  }

  @Override
  public boolean exists(StorageLocator locator) {
    try {
      return objectExists(key(locator));
    } catch (SdkException ex) {
      throw new StorageReadException(
          "Cannot check s3://" + bucket + "/" + key(locator) + ": " + ex.getMessage(), ex,
          isTransient(ex));
    }
  }

  @Override
  public StorageResult<List<String>> listSeries() {
    List<String> series = new ArrayList<>();
    try {
      ListObjectsV2Request request = ListObjectsV2Request.builder()
          .bucket(bucket)
          .prefix(prefix)
          .delimiter("/")
          .build();
      for (ListObjectsV2Response page : s3.listObjectsV2Paginator(request)) {
        for (CommonPrefix common : page.commonPrefixes()) {
          String name = common.prefix().substring(prefix.length());
          if (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
          }
          if (!name.isEmpty()) {
            series.add(name);
          }
        }
      }
    } catch (SdkException ex) {
      return failure(ex, false, "list s3://" + bucket + "/" + prefix);
    }
    Collections.sort(series);
    return StorageResult.ok(List.copyOf(series));
  }

  @Override
  public StorageResult<Void> delete(StorageLocator locator) {
    String key = key(locator);
    try {
      s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      return StorageResult.ok();
    } catch (SdkException ex) {
      return failure(ex, true, "delete s3://" + bucket + "/" + key);
    }
  }

  private boolean objectExists(String key) {
    try {
      s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException ex) {
      return false;
    } catch (S3Exception ex) {
      if (ex.statusCode() == 404) {
        return false;
      }
      throw ex;
    }
  }

  private static <T> StorageResult<T> failure(SdkException ex, boolean write, String action) {
    boolean retryable = isTransient(ex);
    String message = "Failed to " + action + ": " + ex.getMessage();
    AnomalyDetectionException error = write
        ? new StorageWriteException(message, ex, retryable)
        : new StorageReadException(message, ex, retryable);
    return retryable ? StorageResult.transientFailure(error) : StorageResult.permanentFailure(error);
  }

  static boolean isTransient(SdkException ex) {
    if (ex instanceof AbortedException) {
      return false;
    }
    if (ex instanceof S3Exception s3Exception) {
      int status = s3Exception.statusCode();
      return status >= 500 || status == 429;
    }
    return ex instanceof SdkClientException;
  }

  private static String normalizePrefix(String prefix) {
    if (prefix == null) {
      return "";
    }
    String trimmed = prefix.strip();
    while (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed.isEmpty() ? "" : trimmed + "/";
  }
}
