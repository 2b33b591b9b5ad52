package com.scholary.pipeline.step;

import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobParams;
import com.scholary.pipeline.result.ResultLog;
import java.util.Optional;

/**
 * What a step sees of the run: the job, whose result log it updates, and the backing document
 * when the job has one.
 */
public record StepContext(Job job, Document document) {

  public ResultLog resultLog() {
    return job.getResult();
  }

  public JobParams params() {
    return job.getParams();
  }

  public Optional<Document> optionalDocument() {
    return Optional.ofNullable(document);
  }
}
