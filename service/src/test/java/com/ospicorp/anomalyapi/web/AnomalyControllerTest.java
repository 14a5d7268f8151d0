package com.ospicorp.anomalyapi.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AnomalyControllerTest {

  private static final Path STORAGE_ROOT = createStorageRoot();

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  @DynamicPropertySource
  static void configureStorage(DynamicPropertyRegistry registry) {
    registry.add("anomaly.storage.root", STORAGE_ROOT::toString);
  }

  private static Path createStorageRoot() {
    try {
      return Files.createTempDirectory("anomaly-models-");
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  @Autowired
  private TestRestTemplate rest;

  private ResponseEntity<Map<String, Object>> post(String path, Object body) {
    return rest.exchange(path, HttpMethod.POST, new HttpEntity<>(body), JSON_MAP);
  }

  private ResponseEntity<Map<String, Object>> get(String path) {
    return rest.exchange(path, HttpMethod.GET, null, JSON_MAP);
  }

  @Test
  void fitThenPredictOverHttp() {
    ResponseEntity<Map<String, Object>> fit = post("/v1/series/temp-1/fit",
        Map.of("values", List.of(20.0, 21.0, 19.5, 20.5, 20.0)));

    assertThat(fit.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(fit.getBody())
        .containsEntry("series_id", "temp-1")
        .containsEntry("version", 1)
        .containsEntry("model_type", "statistical")
        .containsEntry("points_used", 5);

    ResponseEntity<Map<String, Object>> predict =
        post("/v1/series/temp-1/predict", Map.of("value", 35.0));

    assertThat(predict.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(predict.getBody())
        .containsEntry("is_anomaly", true)
        .containsEntry("version_used", 1)
        .containsKey("score");
    assertThat(Files.exists(STORAGE_ROOT.resolve("temp-1").resolve("v1.model"))).isTrue();
  }

  @Test
  void constantSeriesPredictionOmitsScore() {
    post("/v1/series/flat/fit", Map.of("values", List.of(10, 10, 10, 10, 10)));

    ResponseEntity<Map<String, Object>> predict =
        post("/v1/series/flat/predict", Map.of("value", 10.5));

    assertThat(predict.getBody())
        .containsEntry("is_anomaly", true)
        .doesNotContainKey("score");
  }

  @Test
  void listsVersionsAndPinsOne() {
    post("/v1/series/cpu/fit", Map.of("values", List.of(1, 2, 3)));
    post("/v1/series/cpu/fit", Map.of("values", List.of(500, 501, 502)));

    ResponseEntity<Map<String, Object>> versions = get("/v1/series/cpu/versions");
    ResponseEntity<Map<String, Object>> pinned =
        post("/v1/series/cpu/predict", Map.of("value", 2, "version", 1));

    assertThat(versions.getBody())
        .containsEntry("versions", List.of(1, 2))
        .containsEntry("latest", 2);
    assertThat(pinned.getBody())
        .containsEntry("is_anomaly", false)
        .containsEntry("version_used", 1);
    assertThat((Integer) get("/v1/series").getBody().get("trained_series")).isPositive();
  }

  @Test
  void unknownSeriesIsProblemNotFound() {
    ResponseEntity<Map<String, Object>> response =
        post("/v1/series/missing/predict", Map.of("value", 1.0));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    assertThat(response.getBody())
        .containsKeys("type", "title", "status", "detail", "instance")
        .containsEntry("series_id", "missing")
        .containsEntry("operation", "predict");
  }

  @Test
  void insufficientDataIsUnprocessable() {
    ResponseEntity<Map<String, Object>> response =
        post("/v1/series/lonely/fit", Map.of("values", List.of(5)));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody()).containsEntry("error", "InsufficientDataException");
    assertThat(get("/v1/series/lonely/versions").getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void invalidInputIsUnprocessable() {
    assertThat(post("/v1/series/cpu/fit", Map.of("values", List.of())).getStatusCode())
        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(post("/v1/series/bad id/fit", Map.of("values", List.of(1, 2))).getStatusCode())
        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(post("/v1/series/cpu/predict", Map.of("version", 1)).getStatusCode())
        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
  }

  @Test
  void malformedBodyIsBadRequest() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);

    ResponseEntity<Map<String, Object>> response = rest.exchange("/v1/series/cpu/fit",
        HttpMethod.POST, new HttpEntity<>("{\"values\": [1, 2", headers), JSON_MAP);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void adminInvalidateIsAccepted() {
    post("/v1/series/mem/fit", Map.of("values", List.of(1, 2, 3)));

    ResponseEntity<Map<String, Object>> response = post("/admin/series/mem/invalidate", null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    assertThat(response.getBody()).containsEntry("series_id", "mem");
    assertThat(post("/v1/series/mem/predict", Map.of("value", 2)).getBody())
        .containsEntry("version_used", 1);
  }

  @Test
  void metricsExposeTrainingAndInferenceSummaries() {
    post("/v1/series/metered/fit", Map.of("values", List.of(1, 2, 3)));

    ResponseEntity<Map<String, Object>> response = get("/v1/metrics");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsKeys("training", "inference");
    @SuppressWarnings("unchecked")
    Map<String, Object> training = (Map<String, Object>) response.getBody().get("training");
    assertThat(training).containsKeys("count", "avg_latency_ms", "p95_latency_ms");
  }
}
