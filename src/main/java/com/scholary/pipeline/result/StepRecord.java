package com.scholary.pipeline.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Optional;

/**
 * One attempt of a named step.
 *
 * <p>Records are immutable; a state change produces a new record that replaces the old one in the
 * {@link ResultLog} by name.
 *
 * @param name the step name, see {@link StepNames}
 * @param status the attempt's status
 * @param startedAt when the attempt started
 * @param finishedAt when it completed or failed, null while running
 * @param output the step payload, or {@code {"error": ...}} on failure
 */
public record StepRecord(
    @JsonProperty("name") String name,
    @JsonProperty("status") StepStatus status,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("output") ObjectNode output) {

  public static StepRecord running(String name, Instant startedAt) {
    return new StepRecord(name, StepStatus.RUNNING, startedAt, null, null);
  }

  /** A record that is complete from the moment it exists, used for seeded input. */
  public static StepRecord seeded(String name, ObjectNode output, Instant now) {
    return new StepRecord(name, StepStatus.COMPLETED, now, now, output);
  }

  public StepRecord completed(ObjectNode output, Instant finishedAt) {
    return new StepRecord(name, StepStatus.COMPLETED, startedAt, finishedAt, output);
  }

  public StepRecord failed(String message, Instant finishedAt) {
    ObjectNode error = JsonNodeFactory.instance.objectNode();
    error.put("error", message);
    return new StepRecord(name, StepStatus.FAILED, startedAt, finishedAt, error);
  }

  @JsonIgnore
  public boolean isCompleted() {
    return status == StepStatus.COMPLETED;
  }

  /**
   * Read a text field from the output.
   *
   * @return the field's text, empty when the output or field is missing or not textual
   */
  public Optional<String> outputText(String field) {
    if (output == null) {
      return Optional.empty();
    }
    JsonNode value = output.get(field);
    if (value == null || !value.isTextual()) {
      return Optional.empty();
    }
    return Optional.of(value.asText());
  }
}
