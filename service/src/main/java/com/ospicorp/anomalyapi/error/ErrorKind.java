package com.ospicorp.anomalyapi.error;

/** Coarse error classes the HTTP boundary maps to status codes. */
public enum ErrorKind {
  NOT_FOUND,
  INVALID_INPUT,
  STORAGE_UNAVAILABLE,
  TIMEOUT,
  INTERNAL
}
