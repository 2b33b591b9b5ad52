package com.scholary.pipeline.result;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress marker mirrored into the result log.
 *
 * <p>There is no failed value: a failed run keeps {@code running} and carries its failure in the
 * log's error list.
 */
public enum OverallStatus {
  RUNNING("running"),
  COMPLETED("completed");

  private final String value;

  OverallStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
