package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record VersionsResponse(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("versions") List<Integer> versions,
    @JsonProperty("latest") int latest
) {
  static VersionsResponse of(String seriesId, List<Integer> versions) {
    return new VersionsResponse(seriesId, versions, versions.get(versions.size() - 1));
  }
}
