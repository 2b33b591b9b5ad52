package com.scholary.pipeline.result;

import com.fasterxml.jackson.annotation.JsonValue;

/** Status of one step attempt inside a result log. */
public enum StepStatus {
  RUNNING("running"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String value;

  StepStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
