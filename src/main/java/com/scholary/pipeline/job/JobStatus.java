package com.scholary.pipeline.job;

/**
 * Lifecycle of a processing job.
 *
 * <p>PENDING → RUNNING → COMPLETED | FAILED. A FAILED job may be re-entered (RUNNING again);
 * COMPLETED is terminal.
 */
public enum JobStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
