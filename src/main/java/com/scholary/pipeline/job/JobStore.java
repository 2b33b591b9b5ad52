package com.scholary.pipeline.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for jobs and their result logs.
 *
 * <p>Every write is a snapshot: later changes to the {@link Job} instance are not visible to
 * readers until the next write. The orchestrator relies on this to commit each step transition
 * before moving on.
 */
public interface JobStore {

  /**
   * Store a new job.
   *
   * @throws JobStoreException if the write fails or the id is taken
   */
  void create(Job job);

  /**
   * Overwrite the stored state of a job, result log included.
   *
   * @throws JobStoreException if the write fails
   */
  void save(Job job);

  /**
   * Record a failure without writing the result log.
   *
   * <p>This is the fallback used when a full {@link #save} of a failed job did not go through.
   *
   * @throws JobStoreException if the job is unknown or the write fails
   */
  void markFailed(String jobId, String error, Instant finishedAt);

  Optional<Job> findById(String jobId);

  /** Jobs of one owner matching the filter, newest first. */
  List<Job> findByOwner(String ownerId, JobFilter filter);

  long countByOwner(String ownerId);

  long countByOwnerAndType(String ownerId, JobType type);
}
