package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.pipeline.job.InputSnapshot;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobParams;
import com.scholary.pipeline.job.JobStatus;
import com.scholary.pipeline.job.JobType;
import com.scholary.pipeline.result.ResultLog;
import java.time.Instant;

/** A job as shown to its owner. List views leave out the input, the log and the error. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
    @JsonProperty("id") String id,
    @JsonProperty("type") JobType type,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("params") JobParams params,
    @JsonProperty("input") InputSnapshot input,
    @JsonProperty("result") ResultLog result,
    @JsonProperty("error") String error,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt) {

  public static JobResponse summary(Job job) {
    return new JobResponse(
        job.getId(),
        job.getType(),
        job.getStatus(),
        job.getDocumentId(),
        job.getParams(),
        null,
        null,
        null,
        job.getCreatedAt(),
        job.getStartedAt(),
        job.getFinishedAt());
  }

  public static JobResponse detail(Job job) {
    return new JobResponse(
        job.getId(),
        job.getType(),
        job.getStatus(),
        job.getDocumentId(),
        job.getParams(),
        job.getInput(),
        job.getResult(),
        job.getError(),
        job.getCreatedAt(),
        job.getStartedAt(),
        job.getFinishedAt());
  }
}
