package com.ospicorp.anomalyapi.storage;

import java.util.List;

/**
 * Byte-level persistence of model versions. Implementations never branch on the caller and the
 * model store never branches on the implementation.
 */
public interface StorageBackend {

  /** Short name used in logs, e.g. {@code filesystem} or {@code s3}. */
  String name();

  /**
   * Writes {@code data} so that readers see either nothing or the complete bytes. Writing to a
   * locator that already exists is a permanent failure carrying a
   * {@link com.ospicorp.anomalyapi.error.StorageIntegrityException}.
   */
  StorageResult<Void> put(StorageLocator locator, byte[] data);

  /** Missing locators yield {@link StorageResult.Status#NOT_FOUND}. */
  StorageResult<byte[]> get(StorageLocator locator);

  /** Ascending versions stored for the series; empty when the series is unknown. */
  StorageResult<List<Integer>> listVersions(String seriesId);

  /** Never throws for a missing key. */
  boolean exists(StorageLocator locator);

  /** Series that hold at least one model version. */
  StorageResult<List<String>> listSeries();

  /** Removes one version; deleting a missing locator succeeds. */
  StorageResult<Void> delete(StorageLocator locator);
}
