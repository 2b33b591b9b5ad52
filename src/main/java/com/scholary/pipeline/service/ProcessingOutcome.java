package com.scholary.pipeline.service;

import com.scholary.pipeline.job.Job;

/**
 * Result of a single-step request: either a job that ran, or the value the document already held.
 *
 * @param job the job that ran, null when the stored value was returned
 * @param value the primary output (transcript, summary or translation), null if the job failed
 */
public record ProcessingOutcome(Job job, String value) {

  public static final String EXISTING = "existing";

  public static ProcessingOutcome existing(String value) {
    return new ProcessingOutcome(null, value);
  }

  public boolean isExisting() {
    return job == null;
  }

  public String jobId() {
    return isExisting() ? null : job.getId();
  }

  /** {@value #EXISTING}, or the job's status name. */
  public String status() {
    return isExisting() ? EXISTING : job.getStatus().name();
  }
}
