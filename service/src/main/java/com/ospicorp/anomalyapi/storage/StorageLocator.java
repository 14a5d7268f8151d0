package com.ospicorp.anomalyapi.storage;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic address of one model version: {@code {seriesId}/v{version}.model}, relative to
 * the backend's root directory or key prefix. Two versions never share a locator.
 */
public record StorageLocator(String seriesId, int version) {
  public static final String EXTENSION = ".model";

  private static final Pattern FILE_NAME = Pattern.compile("^v([1-9][0-9]{0,9})\\.model$");

  public StorageLocator {
    if (seriesId == null || seriesId.isEmpty()) {
      throw new IllegalArgumentException("seriesId must be provided");
    }
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1, got " + version);
    }
  }

  public String fileName() {
    return "v" + version + EXTENSION;
  }

  public String relativePath() {
    return seriesId + "/" + fileName();
  }

  /** Version encoded in a model file name, empty for anything else (temp files, strays). */
  public static OptionalInt parseVersion(String fileName) {
    Matcher matcher = FILE_NAME.matcher(fileName);
    if (!matcher.matches()) {
      return OptionalInt.empty();
    }
    long version = Long.parseLong(matcher.group(1));
    return version > Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of((int) version);
  }

  @Override
  public String toString() {
    return relativePath();
  }
}
