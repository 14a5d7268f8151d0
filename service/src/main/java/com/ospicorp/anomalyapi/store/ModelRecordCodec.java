package com.ospicorp.anomalyapi.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ospicorp.anomalyapi.error.ModelStateCorruptException;
import com.ospicorp.anomalyapi.error.StorageIntegrityException;
import com.ospicorp.anomalyapi.storage.StorageLocator;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON envelope around a {@link ModelRecord}; metadata and model state share one object so a
 * single atomic put commits both.
 */
public class ModelRecordCodec {
  private final ObjectMapper mapper;

  public ModelRecordCodec() {
    this(new ObjectMapper());
  }

  public ModelRecordCodec(ObjectMapper base) {
    this.mapper = base.copy()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public byte[] encode(ModelRecord record) {
    try {
      return mapper.writeValueAsBytes(record);
    } catch (IOException ex) {
      throw new UncheckedIOException("Could not encode model record " + record.seriesId()
          + "/v" + record.version(), ex);
    }
  }

  /** Decodes the bytes read from {@code locator} and checks they describe that locator. */
  public ModelRecord decode(StorageLocator locator, byte[] data) {
    ModelRecord record;
    try {
      record = mapper.readValue(data, ModelRecord.class);
    } catch (IOException ex) {
      throw new ModelStateCorruptException("Unreadable model record at " + locator, ex);
    }
    if (record.state() == null || record.modelType() == null) {
      throw new ModelStateCorruptException("Incomplete model record at " + locator, null);
    }
    if (!locator.seriesId().equals(record.seriesId()) || locator.version() != record.version()) {
      throw new StorageIntegrityException("Record at " + locator + " describes "
          + record.seriesId() + "/v" + record.version());
    }
    return record;
  }
}
