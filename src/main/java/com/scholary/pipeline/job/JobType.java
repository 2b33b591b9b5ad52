package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Kind of job, as listed and filtered by callers. */
public enum JobType {
  TRANSCRIBE("transcribe"),
  SUMMARIZE("summarize"),
  TRANSLATE("translate"),
  NOTES("notes"),
  QUIZ("quiz"),
  COMPOSITE("composite"),
  INGEST("ingest");

  private final String value;

  JobType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static Optional<JobType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.value.equals(normalized)).findFirst();
  }
}
