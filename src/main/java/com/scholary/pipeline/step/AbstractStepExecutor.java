package com.scholary.pipeline.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.document.DocumentStore;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.logging.StructuredLogger;
import com.scholary.pipeline.result.ResultLog;
import com.scholary.pipeline.result.StepRecord;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol shared by all capability steps.
 *
 * <ol>
 *   <li>A step that already completed in this log is returned untouched.
 *   <li>Otherwise a running record is opened and {@link #run} does the work, including any write to
 *       the backing document.
 *   <li>On success the record is completed, upserted and the job is saved before returning.
 *   <li>On failure the record is marked failed with the error message and upserted, and the error
 *       propagates. Saving the failed log is left to the orchestrator.
 * </ol>
 */
public abstract class AbstractStepExecutor implements StepExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStepExecutor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final DocumentStore documentStore;

  protected AbstractStepExecutor(JobStore jobStore, DocumentStore documentStore) {
    this.jobStore = jobStore;
    this.documentStore = documentStore;
  }

  @Override
  public final ResultLog execute(StepContext context) {
    ResultLog log = context.resultLog();
    String jobId = context.job().getId();

    if (log.findCompleted(name()).isPresent()) {
      structuredLogger.logStepSkipped(jobId, name());
      return log;
    }

    StepRecord record = StepRecord.running(name(), Instant.now());
    structuredLogger.logStepStarted(jobId, name());
    long startTime = System.currentTimeMillis();

    try {
      ObjectNode output = run(context);
      log.upsert(record.completed(output, Instant.now()));
      context.job().setResult(log);
      jobStore.save(context.job());

      structuredLogger.logStepCompleted(jobId, name(), System.currentTimeMillis() - startTime);
      return log;
    } catch (RuntimeException e) {
      String message = StepExecutionException.describe(e);
      log.upsert(record.failed(message, Instant.now()));
      structuredLogger.logStepFailed(
          jobId, name(), System.currentTimeMillis() - startTime, e.getClass().getSimpleName(), message);

      if (e instanceof InputException inputException) {
        throw inputException;
      }
      throw new StepExecutionException(name(), e);
    }
  }

  /**
   * Do the step's work.
   *
   * @return the output payload to record
   */
  protected abstract ObjectNode run(StepContext context);

  /** Persist a change to the backing document. */
  protected void saveDocument(Document document) {
    document.touch();
    documentStore.save(document);
  }

  /** The text field of a completed earlier step, if present and not blank. */
  protected static Optional<String> completedText(ResultLog log, String step, String field) {
    return log.findCompleted(step).flatMap(r -> r.outputText(field)).filter(t -> !t.isBlank());
  }

  protected static Optional<String> nonBlank(String value) {
    return Optional.ofNullable(value).filter(v -> !v.isBlank());
  }

  protected static JsonNode orNull(JsonNode node) {
    return node == null ? NullNode.getInstance() : node;
  }
}
