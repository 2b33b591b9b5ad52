package com.scholary.pipeline.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log job and step events with structured fields that can be queried
 * once the logs are shipped.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job status change. */
  public void logJobTransition(String jobId, String from, String to) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("fromStatus", from);
      MDC.put("status", to);

      logger.info("Job transition: jobId={}, {} -> {}", jobId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /**
   * Log a job failure with its cause.
   *
   * @param step the step that failed, or null when the job failed outside a step
   */
  public void logJobFailed(String jobId, String step, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("status", "FAILED");
      MDC.put("errorType", errorType);
      if (step != null) {
        MDC.put("step", step);
      }

      logger.warn(
          "Job failed: jobId={}, step={}, error={}, message={}", jobId, step, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log step started event. */
  public void logStepStarted(String jobId, String step) {
    try {
      MDC.put("event_type", "step_started");
      MDC.put("step", step);

      logger.debug("Step started: jobId={}, step={}", jobId, step);
    } finally {
      clearEventFields();
    }
  }

  /** Log a step that was already completed and is not run again. */
  public void logStepSkipped(String jobId, String step) {
    try {
      MDC.put("event_type", "step_skipped");
      MDC.put("step", step);

      logger.info("Step already completed, skipping: jobId={}, step={}", jobId, step);
    } finally {
      clearEventFields();
    }
  }

  /** Log step finished event. */
  public void logStepCompleted(String jobId, String step, long durationMs) {
    try {
      MDC.put("event_type", "step_completed");
      MDC.put("step", step);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Step completed: jobId={}, step={}, duration={}ms", jobId, step, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log step failure event. */
  public void logStepFailed(
      String jobId, String step, long durationMs, String errorType, String message) {
    try {
      MDC.put("event_type", "step_failed");
      MDC.put("step", step);
      MDC.put("durationMs", String.valueOf(durationMs));
      MDC.put("errorType", errorType);

      logger.error(
          "Step failed: jobId={}, step={}, duration={}ms, error={}, message={}",
          jobId,
          step,
          durationMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retried backend call. */
  public void logCapabilityRetry(
      String capability, int attempt, int maxRetries, long backoffMs, String message) {
    try {
      MDC.put("event_type", "capability_retry");
      MDC.put("capability", capability);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));

      logger.warn(
          "Capability retry: capability={}, attempt={}/{}, backoff={}ms, message={}",
          capability,
          attempt,
          maxRetries,
          backoffMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String jobType, String documentId) {
    MDC.put("jobId", jobId);
    MDC.put("jobType", jobType);
    if (documentId != null) {
      MDC.put("documentId", documentId);
    }
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("jobType");
    MDC.remove("documentId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromStatus");
    MDC.remove("status");
    MDC.remove("step");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("capability");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
  }
}
