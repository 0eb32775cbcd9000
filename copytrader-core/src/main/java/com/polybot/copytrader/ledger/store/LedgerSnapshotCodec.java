package com.polybot.copytrader.ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.polybot.copytrader.ledger.model.LedgerSnapshot;
import lombok.NonNull;

/**
 * JSON form of {@link LedgerSnapshot}, shared by the file and JDBC stores.
 */
public final class LedgerSnapshotCodec {

  private final ObjectMapper objectMapper;

  public LedgerSnapshotCodec() {
    this(defaultObjectMapper());
  }

  public LedgerSnapshotCodec(@NonNull ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String write(LedgerSnapshot snapshot) throws JsonProcessingException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
  }

  public LedgerSnapshot read(String json) throws JsonProcessingException {
    return objectMapper.readValue(json, LedgerSnapshot.class);
  }
}
