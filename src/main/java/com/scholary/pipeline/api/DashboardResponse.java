package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobStatus;
import com.scholary.pipeline.job.JobType;
import com.scholary.pipeline.service.DashboardSummary;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Per-owner dashboard: counts plus the latest documents and jobs. */
public record DashboardResponse(
    @JsonProperty("counts") Counts counts,
    @JsonProperty("recent_documents") List<RecentDocument> recentDocuments,
    @JsonProperty("recent_activity") List<RecentJob> recentActivity) {

  public record Counts(
      @JsonProperty("documents") long documents,
      @JsonProperty("jobs") long jobs,
      @JsonProperty("jobs_by_type") Map<String, Long> jobsByType) {}

  public record RecentDocument(
      @JsonProperty("id") String id,
      @JsonProperty("name") String name,
      @JsonProperty("mime_type") String mimeType,
      @JsonProperty("size_bytes") long sizeBytes,
      @JsonProperty("created_at") Instant createdAt) {

    static RecentDocument from(Document document) {
      return new RecentDocument(
          document.getId(),
          document.getOriginalName(),
          document.getMimeType(),
          document.getSizeBytes(),
          document.getCreatedAt());
    }
  }

  public record RecentJob(
      @JsonProperty("id") String id,
      @JsonProperty("type") JobType type,
      @JsonProperty("status") JobStatus status,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("document_id") String documentId) {

    static RecentJob from(Job job) {
      return new RecentJob(
          job.getId(), job.getType(), job.getStatus(), job.getCreatedAt(), job.getDocumentId());
    }
  }

  public static DashboardResponse from(DashboardSummary summary) {
    return new DashboardResponse(
        new Counts(summary.documents(), summary.jobs(), summary.jobsByType()),
        summary.recentDocuments().stream().map(RecentDocument::from).toList(),
        summary.recentJobs().stream().map(RecentJob::from).toList());
  }
}
