package com.scholary.pipeline.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, name-unique collection of step records attached to a job.
 *
 * <p>A log is owned by a single orchestration run and mutated sequentially; it is not
 * thread-safe. Records are replaced by name and never removed, so the order of the list is the
 * order in which each step was first attempted.
 */
public class ResultLog {

  private OverallStatus overallStatus;
  private final List<StepRecord> steps;
  private final List<ErrorEntry> errors;

  @JsonCreator
  public ResultLog(
      @JsonProperty("overall_status") OverallStatus overallStatus,
      @JsonProperty("steps") List<StepRecord> steps,
      @JsonProperty("errors") List<ErrorEntry> errors) {
    this.overallStatus = overallStatus == null ? OverallStatus.RUNNING : overallStatus;
    this.steps = steps == null ? new ArrayList<>() : new ArrayList<>(steps);
    this.errors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
  }

  /** A fresh log: running, no steps, no errors. */
  public static ResultLog init() {
    return new ResultLog(OverallStatus.RUNNING, List.of(), List.of());
  }

  /**
   * Look up a step that has completed.
   *
   * <p>Running and failed records are invisible here, so a failed step is retried rather than
   * treated as cached.
   */
  public Optional<StepRecord> findCompleted(String name) {
    return steps.stream().filter(s -> s.name().equals(name) && s.isCompleted()).findFirst();
  }

  /** Look up a step by name regardless of its status. */
  public Optional<StepRecord> find(String name) {
    return steps.stream().filter(s -> s.name().equals(name)).findFirst();
  }

  /**
   * Replace the record with the same name, or append it if the name is new.
   *
   * @return this log
   */
  public ResultLog upsert(StepRecord step) {
    for (int i = 0; i < steps.size(); i++) {
      if (steps.get(i).name().equals(step.name())) {
        steps.set(i, step);
        return this;
      }
    }
    steps.add(step);
    return this;
  }

  public void markCompleted() {
    this.overallStatus = OverallStatus.COMPLETED;
  }

  public void addError(String message, Instant time) {
    errors.add(new ErrorEntry(message, time));
  }

  @JsonProperty("overall_status")
  public OverallStatus getOverallStatus() {
    return overallStatus;
  }

  @JsonProperty("steps")
  public List<StepRecord> getSteps() {
    return Collections.unmodifiableList(steps);
  }

  @JsonProperty("errors")
  public List<ErrorEntry> getErrors() {
    return Collections.unmodifiableList(errors);
  }
}
