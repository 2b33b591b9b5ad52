package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobStatus;
import com.scholary.pipeline.result.ResultLog;
import com.scholary.pipeline.service.ProcessingOutcome;

/**
 * Answer to a processing request.
 *
 * <p>A job that ran carries its id, status and result log, plus the primary value of single-step
 * jobs under the step's own field name. A failed job carries the error instead of the log. A
 * stored value returned without running has status {@code existing} and no job id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResponse(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status") String status,
    @JsonProperty("result") ResultLog result,
    @JsonProperty("transcription") String transcription,
    @JsonProperty("summary") String summary,
    @JsonProperty("translation") String translation,
    @JsonProperty("error") String error) {

  enum Field {
    TRANSCRIPTION,
    SUMMARY,
    TRANSLATION
  }

  public static ProcessingResponse fromJob(Job job) {
    if (job.getStatus() == JobStatus.FAILED) {
      return failed(job);
    }
    return new ProcessingResponse(
        job.getId(), job.getStatus().name(), job.getResult(), null, null, null, null);
  }

  static ProcessingResponse fromOutcome(ProcessingOutcome outcome, Field field) {
    Job job = outcome.job();
    if (job != null && job.getStatus() == JobStatus.FAILED) {
      return failed(job);
    }
    String value = outcome.value();
    return new ProcessingResponse(
        outcome.jobId(),
        outcome.status(),
        job == null ? null : job.getResult(),
        field == Field.TRANSCRIPTION ? value : null,
        field == Field.SUMMARY ? value : null,
        field == Field.TRANSLATION ? value : null,
        null);
  }

  private static ProcessingResponse failed(Job job) {
    return new ProcessingResponse(
        job.getId(), JobStatus.FAILED.name(), null, null, null, null, job.getError());
  }

  @JsonIgnore
  public boolean isFailed() {
    return JobStatus.FAILED.name().equals(status);
  }
}
