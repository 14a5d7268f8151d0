package com.ospicorp.anomalyapi.store;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.ospicorp.anomalyapi.detection.DetectionStrategy;
import com.ospicorp.anomalyapi.detection.ModelFactory;
import com.ospicorp.anomalyapi.error.FitPersistException;
import com.ospicorp.anomalyapi.error.ModelNotFoundException;
import com.ospicorp.anomalyapi.error.SeriesNotFoundException;
import com.ospicorp.anomalyapi.error.StorageIntegrityException;
import com.ospicorp.anomalyapi.metrics.AnomalyMetrics;
import com.ospicorp.anomalyapi.storage.StorageBackend;
import com.ospicorp.anomalyapi.storage.StorageLocator;
import com.ospicorp.anomalyapi.storage.StorageResult;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Versioning and concurrency authority for per-series models.
 *
 * <p>Fits of one series are serialized by a lock owned by that series; the lock covers reading
 * the current version, writing the next one and publishing it to the cache, and nothing else.
 * Predictions never take it: they read the cache, or load the newest stored version on a miss,
 * and may see the previous version while a fit is in flight.
 *
 * <p>Transient storage failures are retried here with bounded exponential backoff; permanent
 * failures return at once.
 */
public class ModelStore {

  private static final Logger log = LoggerFactory.getLogger(ModelStore.class);

  private final StorageBackend backend;
  private final ModelFactory factory;
  private final ModelRecordCodec codec;
  private final AnomalyMetrics metrics;
  private final BackoffPolicy backoff;
  private final String modelType;
  private final int retainVersions;
  private final Clock clock;
  private final ConcurrentMap<String, ReentrantLock> seriesLocks = new ConcurrentHashMap<>();
  private final Cache<String, ModelCacheEntry> cache;

  public ModelStore(StorageBackend backend, ModelFactory factory, ModelRecordCodec codec,
      AnomalyMetrics metrics, Settings settings, Clock clock) {
    this.backend = backend;
    this.factory = factory;
    this.codec = codec;
    this.metrics = metrics;
    this.backoff = settings.backoff();
    this.modelType = settings.modelType();
    this.retainVersions = settings.retainVersions();
    this.clock = clock;
    this.cache = CacheBuilder.newBuilder()
        .maximumSize(settings.cacheMaxEntries())
        .build();
    // fail at startup rather than on the first fit
    factory.create(modelType);
  }

  /**
   * Fits a new model for the series and commits it as the next version.
   *
   * @return the committed record
   * @throws FitPersistException if the version could not be written; nothing is committed or
   *     cached in that case
   */
  public ModelRecord fit(String seriesId, double[] values) {
    DetectionStrategy strategy = factory.create(modelType);
    strategy.fit(values);
    byte[] state = strategy.serialize();

    ReentrantLock lock = seriesLocks.computeIfAbsent(seriesId, id -> new ReentrantLock());
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new FitPersistException(seriesId, "interrupted while waiting for the series lock", ex);
    }
    try {
      StorageResult<List<Integer>> listed =
          withRetry("list versions of " + seriesId, () -> backend.listVersions(seriesId));
      if (!listed.isOk()) {
        throw new FitPersistException(seriesId, "current version unknown", listed.error());
      }
      List<Integer> versions = listed.value();
      int next = latest(seriesId, versions) + 1;
      ModelRecord record = new ModelRecord(seriesId, next, strategy.modelType(), state,
          clock.instant(), values.length);
      StorageLocator locator = new StorageLocator(seriesId, next);
      byte[] encoded = codec.encode(record);

      if (Thread.currentThread().isInterrupted()) {
        throw new FitPersistException(seriesId, "cancelled before commit", null);
      }
      StorageResult<Void> written = withRetry("write " + locator, () -> backend.put(locator, encoded));
      if (!written.isOk()) {
        if (written.error() instanceof StorageIntegrityException integrity) {
          throw integrity;
        }
        log.error("Fit of series '{}' not committed at v{}: {}", seriesId, next,
            written.error().getMessage());
        throw new FitPersistException(seriesId, "write of v" + next + " failed", written.error());
      }

      cache.asMap().merge(seriesId,
          new ModelCacheEntry(seriesId, next, strategy, clock.millis()), ModelCacheEntry::newer);
      log.info("Committed model: series_id='{}', version={}, type='{}', samples={}, backend={}",
          seriesId, next, record.modelType(), values.length, backend.name());
      pruneOldVersions(seriesId, versions, next);
      return record;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Model at the newest version known to this store, from the cache when present.
   *
   * @throws SeriesNotFoundException if the series was never fitted
   */
  public LoadedModel getForPredict(String seriesId) {
    ModelCacheEntry cached = cache.getIfPresent(seriesId);
    if (cached != null) {
      metrics.cacheHit();
      return cached.touch(clock.millis());
    }
    metrics.cacheMiss();

    List<Integer> versions =
        withRetry("list versions of " + seriesId, () -> backend.listVersions(seriesId)).orElseThrow();
    if (versions.isEmpty()) {
      throw new SeriesNotFoundException(seriesId);
    }
    int latest = latest(seriesId, versions);
    ModelCacheEntry loaded = new ModelCacheEntry(seriesId, latest, read(seriesId, latest),
        clock.millis());
    ModelCacheEntry current = cache.asMap().merge(seriesId, loaded, ModelCacheEntry::newer);
    log.info("Loaded model: series_id='{}', version={} from {}", seriesId, latest, backend.name());
    return current.touch(clock.millis());
  }

  /**
   * Model at an exact version. Bypasses the cache unless the cached entry is that version.
   *
   * @throws ModelNotFoundException if the version is not stored
   */
  public LoadedModel load(String seriesId, int version) {
    if (version < 1) {
      throw new ModelNotFoundException(seriesId, version);
    }
    ModelCacheEntry cached = cache.getIfPresent(seriesId);
    if (cached != null && cached.version() == version) {
      metrics.cacheHit();
      return cached.touch(clock.millis());
    }
    return new LoadedModel(seriesId, version, read(seriesId, version));
  }

  public List<Integer> listVersions(String seriesId) {
    List<Integer> versions =
        withRetry("list versions of " + seriesId, () -> backend.listVersions(seriesId)).orElseThrow();
    latest(seriesId, versions);
    return versions;
  }

  public List<String> listSeries() {
    return withRetry("list series", backend::listSeries).orElseThrow();
  }

  public void invalidate(String seriesId) {
    cache.invalidate(seriesId);
    log.info("Invalidated cached model for series_id='{}'", seriesId);
  }

  /** Version currently cached for the series, or 0 when none is. */
  public int cachedVersion(String seriesId) {
    ModelCacheEntry cached = cache.getIfPresent(seriesId);
    return cached == null ? 0 : cached.version();
  }

  public long cachedEntries() {
    return cache.size();
  }

  private DetectionStrategy read(String seriesId, int version) {
    StorageLocator locator = new StorageLocator(seriesId, version);
    byte[] data = withRetry("read " + locator, () -> backend.get(locator)).orElseThrow();
    ModelRecord record = codec.decode(locator, data);
    DetectionStrategy strategy = factory.create(record.modelType());
    strategy.deserialize(record.state());
    return strategy;
  }

  /**
   * Highest stored version, 0 for a new series. Backends report versions ascending; a
   * duplicate or out-of-order entry means two writers raced and is not resolved here.
   */
  private static int latest(String seriesId, List<Integer> versions) {
    int previous = 0;
    for (int version : versions) {
      if (version <= previous) {
        throw new StorageIntegrityException("Series '" + seriesId
            + "' reports ambiguous versions " + versions);
      }
      previous = version;
    }
    return previous;
  }

  private <T> StorageResult<T> withRetry(String action, Supplier<StorageResult<T>> call) {
    StorageResult<T> result = call.get();
    for (int retry = 1; retry <= backoff.maxRetries() && result.isTransientFailure(); retry++) {
      Duration delay = backoff.delayBefore(retry);
      log.warn("Transient storage failure on {} (retry {}/{} in {} ms): {}", action, retry,
          backoff.maxRetries(), delay.toMillis(), result.error().getMessage());
      metrics.storageRetry();
      if (!pause(delay)) {
        return result;
      }
      result = call.get();
    }
    return result;
  }

  private void pruneOldVersions(String seriesId, List<Integer> before, int committed) {
    if (retainVersions <= 0) {
      return;
    }
    int oldestKept = committed - retainVersions + 1;
    for (int version : before) {
      if (version >= oldestKept) {
        break;
      }
      StorageResult<Void> deleted = backend.delete(new StorageLocator(seriesId, version));
      if (!deleted.isOk()) {
        log.warn("Could not prune series_id='{}' v{}, will retry after the next fit: {}",
            seriesId, version, deleted.error().getMessage());
        return;
      }
      log.debug("Pruned series_id='{}' v{}", seriesId, version);
    }
  }

  private static boolean pause(Duration delay) {
    try {
      TimeUnit.MILLISECONDS.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * @param modelType strategy used for new fits; stored versions load with their own type
   * @param retainVersions versions kept per series after a fit, 0 keeps all
   */
  public record Settings(String modelType, long cacheMaxEntries, BackoffPolicy backoff,
      int retainVersions) {
    public Settings {
      if (cacheMaxEntries < 1) {
        throw new IllegalArgumentException("cacheMaxEntries must be at least 1");
      }
      if (retainVersions < 0) {
        throw new IllegalArgumentException("retainVersions must be >= 0");
      }
    }
  }
}
