package com.ospicorp.recordsapi.records;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A date-stamped JSON document. {@code id} and {@code createdAt} are null until the record has
 * been persisted. On the wire {@code date} is written as midnight UTC, e.g.
 * {@code 2024-03-01T00:00:00Z}.
 */
public record DataRecord(
    Long id,
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'00:00:00'Z'")
    LocalDate date,
    ObjectNode data,
    @JsonProperty("created_at") Instant createdAt
) {

  public static DataRecord unsaved(LocalDate date, ObjectNode data) {
    return new DataRecord(null, date, data, null);
  }
}
