package com.scholary.pipeline.service;

import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.document.DocumentStore;
import com.scholary.pipeline.job.InputSnapshot;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobParams;
import com.scholary.pipeline.job.JobStatus;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.job.JobType;
import com.scholary.pipeline.logging.StructuredLogger;
import com.scholary.pipeline.result.ResultLog;
import com.scholary.pipeline.result.StepNames;
import com.scholary.pipeline.step.InputTextStep;
import com.scholary.pipeline.step.StepContext;
import com.scholary.pipeline.step.StepExecutionException;
import com.scholary.pipeline.step.StepExecutor;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a job's operations in order against its result log.
 *
 * <p>Every transition is saved before the next operation starts, so a job read from the store
 * always shows how far the run got. The first failing step ends the run: the job becomes FAILED
 * with the partial log kept, and document changes made by earlier steps stay in place. Step errors
 * are recorded on the job and never thrown to the caller.
 *
 * <p>Runs execute on the calling thread. Two runs touching the same job or document are not
 * coordinated.
 */
@Service
public class JobOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final DocumentStore documentStore;
  private final InputTextStep inputTextStep;
  private final Map<String, StepExecutor> executors;

  public JobOrchestrator(
      JobStore jobStore,
      DocumentStore documentStore,
      InputTextStep inputTextStep,
      List<StepExecutor> stepExecutors) {
    this.jobStore = jobStore;
    this.documentStore = documentStore;
    this.inputTextStep = inputTextStep;
    this.executors =
        stepExecutors.stream()
            .collect(Collectors.toUnmodifiableMap(StepExecutor::name, Function.identity()));

    LOGGER.info("Initialized job orchestrator: steps={}", executors.keySet());
  }

  /** Create and store a PENDING job. Nothing runs yet. */
  public Job create(
      String ownerId, JobType type, String documentId, JobParams params, InputSnapshot input) {
    Job job = new Job(UUID.randomUUID().toString(), ownerId, type, documentId, params, input);
    jobStore.create(job);
    LOGGER.info("Job created: jobId={}, type={}, documentId={}", job.getId(), type.value(), documentId);
    return job;
  }

  /**
   * Run a job to completion or first failure.
   *
   * @param job the job to run; its result log is created if it has none
   * @param document the backing document, or null
   * @param adHocText caller-supplied text to seed as {@code input_text}, or null
   * @return the job in its final state, COMPLETED or FAILED
   */
  public Job run(Job job, Document document, String adHocText) {
    StructuredLogger.setJobContext(job.getId(), job.getType().value(), job.getDocumentId());
    try {
      try {
        begin(job);
        List<String> operations = job.getParams().operations();
        validate(operations);

        StepContext context = new StepContext(job, document);
        if (shouldSeed(operations, adHocText)) {
          inputTextStep.seed(context, adHocText);
        }
        for (String operation : operations) {
          executors.get(operation).execute(context);
        }

        complete(job);
      } catch (RuntimeException e) {
        fail(job, e);
      }
      return job;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Run a stored job again with the log it already has. Completed steps are skipped, so only the
   * failed step and those after it do work.
   *
   * <p>A PENDING job simply runs; ad-hoc text is recovered from its input snapshot, which may be
   * truncated.
   *
   * @throws IllegalStateException if the job already completed
   */
  public Job resume(Job job) {
    if (job.getStatus() == JobStatus.COMPLETED) {
      throw new IllegalStateException("Job already completed: " + job.getId());
    }

    Document document =
        job.getDocumentId() == null ? null : documentStore.findById(job.getDocumentId()).orElse(null);
    String text = job.getInput() == null ? null : job.getInput().textSnippet();

    LOGGER.info("Resuming job: jobId={}, status={}", job.getId(), job.getStatus());
    return run(job, document, text);
  }

  private void begin(Job job) {
    JobStatus previous = job.getStatus();
    job.setStatus(JobStatus.RUNNING);
    if (job.getStartedAt() == null) {
      job.setStartedAt(Instant.now());
    }
    job.setFinishedAt(null);
    job.setError(null);
    if (job.getResult() == null) {
      job.setResult(ResultLog.init());
    }
    jobStore.save(job);
    structuredLogger.logJobTransition(job.getId(), previous.name(), JobStatus.RUNNING.name());
  }

  private void validate(List<String> operations) {
    for (String operation : operations) {
      if (!executors.containsKey(operation)) {
        throw new UnknownOperationException(operation);
      }
    }
  }

  private static boolean shouldSeed(List<String> operations, String adHocText) {
    if (adHocText == null || adHocText.isBlank()) {
      return false;
    }
    return !operations.contains(StepNames.TRANSCRIBE)
        && (operations.contains(StepNames.SUMMARIZE) || operations.contains(StepNames.TRANSLATE));
  }

  private void complete(Job job) {
    job.getResult().markCompleted();
    job.setStatus(JobStatus.COMPLETED);
    job.setFinishedAt(Instant.now());
    jobStore.save(job);
    structuredLogger.logJobTransition(job.getId(), JobStatus.RUNNING.name(), JobStatus.COMPLETED.name());
  }

  private void fail(Job job, RuntimeException cause) {
    String message = safeMessage(cause);
    Instant now = Instant.now();

    ResultLog log = job.getResult() == null ? ResultLog.init() : job.getResult();
    log.addError(message, now);
    job.setResult(log);
    job.setStatus(JobStatus.FAILED);
    job.setError(message);
    job.setFinishedAt(now);
    String failedStep = cause instanceof StepExecutionException stepError ? stepError.getStep() : null;
    structuredLogger.logJobFailed(job.getId(), failedStep, cause.getClass().getSimpleName(), message);

    try {
      jobStore.save(job);
    } catch (RuntimeException saveError) {
      LOGGER.warn(
          "Failed to save failed job, falling back to status write: jobId={}, error={}",
          job.getId(),
          safeMessage(saveError));
      try {
        jobStore.markFailed(job.getId(), message, now);
      } catch (RuntimeException fallbackError) {
        LOGGER.error("Failed to mark job as failed: jobId={}", job.getId(), fallbackError);
      }
    }
  }

  private static String safeMessage(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
