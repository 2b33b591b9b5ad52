package com.scholary.pipeline.job;

/**
 * Criteria for listing an owner's jobs.
 *
 * @param documentId only jobs for this document, null for no document filter
 * @param textOnly only jobs without a document; takes precedence over {@code documentId}
 * @param type only jobs of this type, null for all
 * @param limit maximum number of jobs returned
 */
public record JobFilter(String documentId, boolean textOnly, JobType type, int limit) {

  public static final int DEFAULT_LIMIT = 100;

  public JobFilter {
    if (limit <= 0) {
      limit = DEFAULT_LIMIT;
    }
  }

  public static JobFilter forDocument(String documentId) {
    return new JobFilter(documentId, false, null, Integer.MAX_VALUE);
  }

  public static JobFilter recent(int limit) {
    return new JobFilter(null, false, null, limit);
  }

  boolean matches(Job job) {
    if (textOnly) {
      if (job.getDocumentId() != null) {
        return false;
      }
    } else if (documentId != null && !documentId.equals(job.getDocumentId())) {
      return false;
    }
    return type == null || type == job.getType();
  }
}
