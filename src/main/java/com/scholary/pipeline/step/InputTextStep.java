package com.scholary.pipeline.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.result.ResultLog;
import com.scholary.pipeline.result.StepNames;
import com.scholary.pipeline.result.StepRecord;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Seeds caller-supplied text into a result log as an already completed {@code input_text} step,
 * so text steps can read it like the output of an earlier step.
 */
@Component
public class InputTextStep {

  private final JobStore jobStore;

  public InputTextStep(JobStore jobStore) {
    this.jobStore = jobStore;
  }

  /** Record the text verbatim and save the job. A log that already holds the seed is kept. */
  public ResultLog seed(StepContext context, String text) {
    ResultLog log = context.resultLog();
    if (log.findCompleted(StepNames.INPUT_TEXT).isPresent()) {
      return log;
    }

    ObjectNode output = JsonNodeFactory.instance.objectNode();
    output.put("text", text);
    log.upsert(StepRecord.seeded(StepNames.INPUT_TEXT, output, Instant.now()));
    context.job().setResult(log);
    jobStore.save(context.job());
    return log;
  }
}
