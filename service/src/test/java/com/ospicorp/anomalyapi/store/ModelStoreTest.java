package com.ospicorp.anomalyapi.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.anomalyapi.detection.ModelFactory;
import com.ospicorp.anomalyapi.error.FitPersistException;
import com.ospicorp.anomalyapi.error.InsufficientDataException;
import com.ospicorp.anomalyapi.error.ModelNotFoundException;
import com.ospicorp.anomalyapi.error.ModelStateCorruptException;
import com.ospicorp.anomalyapi.error.SeriesNotFoundException;
import com.ospicorp.anomalyapi.error.StorageIntegrityException;
import com.ospicorp.anomalyapi.error.StorageWriteException;
import com.ospicorp.anomalyapi.error.UnknownModelTypeException;
import com.ospicorp.anomalyapi.metrics.AnomalyMetrics;
import com.ospicorp.anomalyapi.storage.StorageLocator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ModelStoreTest {

  private static final double[] TEMPERATURES = {20.0, 21.0, 19.5, 20.5, 20.0};
  private static final BackoffPolicy FAST_RETRIES =
      new BackoffPolicy(2, Duration.ofMillis(1), Duration.ofMillis(2));
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

  private InMemoryStorageBackend backend;
  private SimpleMeterRegistry registry;
  private ModelStore store;

  @BeforeEach
  void setUp() {
    backend = new InMemoryStorageBackend();
    registry = new SimpleMeterRegistry();
    store = newStore(100, 0);
  }

  private ModelStore newStore(long cacheMaxEntries, int retainVersions) {
    return new ModelStore(backend, ModelFactory.withDefaults(), new ModelRecordCodec(),
        new AnomalyMetrics(registry),
        new ModelStore.Settings("statistical", cacheMaxEntries, FAST_RETRIES, retainVersions),
        CLOCK);
  }

  @Test
  void fitThenPredictUsesTheNewVersion() {
    ModelRecord record = store.fit("temp-1", TEMPERATURES);

    LoadedModel model = store.getForPredict("temp-1");

    assertThat(record.version()).isEqualTo(1);
    assertThat(record.sampleCount()).isEqualTo(5);
    assertThat(record.fittedAt()).isEqualTo(CLOCK.instant());
    assertThat(model.version()).isEqualTo(1);
    assertThat(model.classify(35.0).anomaly()).isTrue();
    assertThat(model.classify(20.3).anomaly()).isFalse();
    assertThat(backend.exists(new StorageLocator("temp-1", 1))).isTrue();
  }

  @Test
  void duplicateListedVersionsAreAnIntegrityError() {
    backend.reportedVersions = List.of(1, 1);

    assertThatThrownBy(() -> store.fit("dup", TEMPERATURES))
        .isInstanceOf(StorageIntegrityException.class)
        .hasMessageContaining("[1, 1]");
    assertThatThrownBy(() -> store.getForPredict("dup"))
        .isInstanceOf(StorageIntegrityException.class);
    assertThat(backend.putCalls).hasValue(0);
    assertThat(store.cachedVersion("dup")).isZero();
  }

  @Test
  void outOfOrderListedVersionsAreAnIntegrityError() {
    backend.reportedVersions = List.of(2, 1);

    assertThatThrownBy(() -> store.fit("shuffled", TEMPERATURES))
        .isInstanceOf(StorageIntegrityException.class);
    assertThatThrownBy(() -> store.getForPredict("shuffled"))
        .isInstanceOf(StorageIntegrityException.class);
    assertThat(backend.putCalls).hasValue(0);
  }

  @Test
  void versionsIncreaseByOnePerFit() {
    for (int i = 0; i < 3; i++) {
      store.fit("cpu", new double[] {i, i + 1.0, i + 2.0});
    }

    assertThat(store.listVersions("cpu")).containsExactly(1, 2, 3);
    assertThat(store.cachedVersion("cpu")).isEqualTo(3);
  }

  @Test
  void concurrentFitsOfOneSeriesProduceContiguousVersions() throws Exception {
    int writers = 16;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<ModelRecord>> results = new ArrayList<>();
    try {
      for (int i = 0; i < writers; i++) {
        double base = i;
        Callable<ModelRecord> fit = () -> {
          start.await();
          return store.fit("shared", new double[] {base, base + 1, base + 2});
        };
        results.add(pool.submit(fit));
      }
      start.countDown();
      List<Integer> versions = new ArrayList<>();
      for (Future<ModelRecord> result : results) {
        versions.add(result.get(10, TimeUnit.SECONDS).version());
      }

      List<Integer> expected = IntStream.rangeClosed(1, writers).boxed()
          .collect(Collectors.toList());
      assertThat(versions).containsExactlyInAnyOrderElementsOf(expected);
      assertThat(store.listVersions("shared")).containsExactlyElementsOf(expected);
      assertThat(store.getForPredict("shared").version()).isEqualTo(writers);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void transientWriteFailuresAreRetried() {
    backend.transientPutFailures.set(2);

    ModelRecord record = store.fit("net", TEMPERATURES);

    assertThat(record.version()).isEqualTo(1);
    assertThat(backend.putCalls).hasValue(3);
    assertThat(registry.counter("anomaly.store.retries").count()).isEqualTo(2.0);
  }

  @Test
  void exhaustedRetriesLeaveThePreviousVersionInPlace() {
    store.fit("net", TEMPERATURES);
    backend.transientPutFailures.set(10);

    assertThatThrownBy(() -> store.fit("net", new double[] {1, 2, 3}))
        .isInstanceOf(FitPersistException.class)
        .hasMessageContaining("net");

    assertThat(backend.putCalls).hasValue(1 + 3);
    assertThat(store.listVersions("net")).containsExactly(1);
    assertThat(store.cachedVersion("net")).isEqualTo(1);

    backend.transientPutFailures.set(0);
    assertThat(store.fit("net", new double[] {1, 2, 3}).version()).isEqualTo(2);
  }

  @Test
  void permanentWriteFailuresAreNotRetried() {
    backend.permanentPutFailure = true;

    assertThatThrownBy(() -> store.fit("disk", TEMPERATURES))
        .isInstanceOf(FitPersistException.class)
        .hasCauseInstanceOf(StorageWriteException.class);

    assertThat(backend.putCalls).hasValue(1);
    assertThat(store.cachedVersion("disk")).isZero();
  }

  @Test
  void insufficientDataFailsBeforeAnyStorageCall() {
    store.fit("temp-1", TEMPERATURES);

    assertThatThrownBy(() -> store.fit("temp-1", new double[] {5}))
        .isInstanceOf(InsufficientDataException.class);

    assertThat(backend.putCalls).hasValue(1);
    assertThat(store.listVersions("temp-1")).containsExactly(1);
  }

  @Test
  void unknownSeriesIsReportedAsNotFound() {
    assertThatThrownBy(() -> store.getForPredict("never-fitted"))
        .isInstanceOf(SeriesNotFoundException.class);
    assertThat(store.listVersions("never-fitted")).isEmpty();
  }

  @Test
  void coldStoreLoadsTheNewestStoredVersion() {
    store.fit("mem", new double[] {1, 2, 3});
    store.fit("mem", new double[] {100, 101, 102});

    ModelStore restarted = newStore(100, 0);
    LoadedModel model = restarted.getForPredict("mem");

    assertThat(model.version()).isEqualTo(2);
    assertThat(model.classify(101).anomaly()).isFalse();
    assertThat(registry.counter("anomaly.cache.misses").count()).isEqualTo(1.0);
    assertThat(restarted.cachedVersion("mem")).isEqualTo(2);
  }

  @Test
  void transientReadFailuresAreRetriedOnLoad() {
    store.fit("mem", TEMPERATURES);
    backend.transientGetFailures.set(2);

    LoadedModel model = newStore(100, 0).getForPredict("mem");

    assertThat(model.version()).isEqualTo(1);
    assertThat(backend.getCalls).hasValue(3);
  }

  @Test
  void invalidateForcesAReloadFromStorage() {
    store.fit("mem", TEMPERATURES);
    store.getForPredict("mem");
    assertThat(backend.getCalls).hasValue(0);

    store.invalidate("mem");

    assertThat(store.cachedVersion("mem")).isZero();
    assertThat(store.getForPredict("mem").version()).isEqualTo(1);
    assertThat(backend.getCalls).hasValue(1);
  }

  @Test
  void loadPinsAnExactVersion() {
    store.fit("cpu", new double[] {1, 2, 3});
    store.fit("cpu", new double[] {1000, 1001, 1002});

    LoadedModel first = store.load("cpu", 1);

    assertThat(first.version()).isEqualTo(1);
    assertThat(first.classify(1000).anomaly()).isTrue();
    assertThat(store.cachedVersion("cpu")).isEqualTo(2);
    assertThatThrownBy(() -> store.load("cpu", 7)).isInstanceOf(ModelNotFoundException.class);
    assertThatThrownBy(() -> store.load("cpu", 0)).isInstanceOf(ModelNotFoundException.class);
  }

  @Test
  void cacheIsBounded() {
    ModelStore small = newStore(2, 0);
    for (String series : List.of("a", "b", "c", "d")) {
      small.fit(series, TEMPERATURES);
    }

    assertThat(small.cachedEntries()).isLessThanOrEqualTo(2);
    assertThat(small.getForPredict("a").version()).isEqualTo(1);
  }

  @Test
  void retentionPrunesOnlyOldVersions() {
    ModelStore pruning = newStore(100, 2);
    for (int i = 0; i < 4; i++) {
      pruning.fit("gc", TEMPERATURES);
    }

    assertThat(pruning.listVersions("gc")).containsExactly(3, 4);
    assertThat(pruning.fit("gc", TEMPERATURES).version()).isEqualTo(5);
  }

  @Test
  void corruptRecordIsNotServed() {
    backend.objects.put("bad/v1.model", "{broken".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> store.getForPredict("bad"))
        .isInstanceOf(ModelStateCorruptException.class);
  }

  @Test
  void recordStoredUnderTheWrongLocatorIsAnIntegrityError() {
    store.fit("src", TEMPERATURES);
    backend.objects.put("dst/v1.model", backend.objects.get("src/v1.model"));

    assertThatThrownBy(() -> store.getForPredict("dst"))
        .isInstanceOf(StorageIntegrityException.class);
  }

  @Test
  void rejectsUnknownConfiguredModelType() {
    assertThatThrownBy(() -> new ModelStore(backend, ModelFactory.withDefaults(),
        new ModelRecordCodec(), new AnomalyMetrics(registry),
        new ModelStore.Settings("arima", 10, FAST_RETRIES, 0), CLOCK))
        .isInstanceOf(UnknownModelTypeException.class);
  }
}
