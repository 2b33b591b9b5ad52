package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.pipeline.result.ResultLog;
import java.time.Instant;

/**
 * A request to run an ordered set of processing steps, with its persisted state.
 *
 * <p>The result log is the only part mutated step by step. {@code finishedAt} is set exactly when
 * the status is COMPLETED or FAILED.
 */
public class Job {

  private String id;
  private String ownerId;
  private JobType type;
  private JobStatus status;
  private String documentId;
  private JobParams params;
  private InputSnapshot input;
  private ResultLog result;
  private String error;
  private Instant createdAt;
  private Instant startedAt;
  private Instant finishedAt;

  protected Job() {}

  public Job(
      String id,
      String ownerId,
      JobType type,
      String documentId,
      JobParams params,
      InputSnapshot input) {
    this.id = id;
    this.ownerId = ownerId;
    this.type = type;
    this.documentId = documentId;
    this.params = params;
    this.input = input;
    this.status = JobStatus.PENDING;
    this.createdAt = Instant.now();
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  @JsonProperty("owner_id")
  public String getOwnerId() {
    return ownerId;
  }

  public void setOwnerId(String ownerId) {
    this.ownerId = ownerId;
  }

  @JsonProperty("type")
  public JobType getType() {
    return type;
  }

  public void setType(JobType type) {
    this.type = type;
  }

  @JsonProperty("status")
  public JobStatus getStatus() {
    return status;
  }

  public void setStatus(JobStatus status) {
    this.status = status;
  }

  @JsonProperty("document_id")
  public String getDocumentId() {
    return documentId;
  }

  public void setDocumentId(String documentId) {
    this.documentId = documentId;
  }

  @JsonProperty("params")
  public JobParams getParams() {
    return params;
  }

  public void setParams(JobParams params) {
    this.params = params;
  }

  @JsonProperty("input")
  public InputSnapshot getInput() {
    return input;
  }

  public void setInput(InputSnapshot input) {
    this.input = input;
  }

  @JsonProperty("result")
  public ResultLog getResult() {
    return result;
  }

  public void setResult(ResultLog result) {
    this.result = result;
  }

  @JsonProperty("error")
  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  @JsonProperty("created_at")
  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  @JsonProperty("started_at")
  public Instant getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  @JsonProperty("finished_at")
  public Instant getFinishedAt() {
    return finishedAt;
  }

  public void setFinishedAt(Instant finishedAt) {
    this.finishedAt = finishedAt;
  }
}
