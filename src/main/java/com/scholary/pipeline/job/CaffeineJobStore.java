package com.scholary.pipeline.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>Jobs are kept as serialized JSON, so a stored job never aliases the instance a running
 * orchestration is mutating, and every read goes through the same serialization round trip as an
 * external reader would. Old jobs are evicted by size and age.
 */
@Repository
public class CaffeineJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineJobStore.class);

  private final Cache<String, String> cache;
  private final ObjectMapper objectMapper;

  public CaffeineJobStore(
      ObjectMapper objectMapper,
      @Value("${pipeline.job-store.max-size}") int maxSize,
      @Value("${pipeline.job-store.expire-after-minutes}") int expireAfterMinutes) {
    this.objectMapper = objectMapper;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();

    LOGGER.info(
        "Initialized job store: maxSize={}, expireAfterMinutes={}", maxSize, expireAfterMinutes);
  }

  @Override
  public void create(Job job) {
    String json = serialize(job);
    String previous = cache.asMap().putIfAbsent(job.getId(), json);
    if (previous != null) {
      throw new JobStoreException("Job already exists: " + job.getId());
    }
  }

  @Override
  public void save(Job job) {
    cache.put(job.getId(), serialize(job));
  }

  @Override
  public void markFailed(String jobId, String error, Instant finishedAt) {
    String updated =
        cache
            .asMap()
            .computeIfPresent(
                jobId,
                (id, json) -> {
                  Job job = deserialize(json);
                  job.setStatus(JobStatus.FAILED);
                  job.setError(error);
                  job.setFinishedAt(finishedAt);
                  return serialize(job);
                });
    if (updated == null) {
      throw new JobStoreException("Job not found: " + jobId);
    }
  }

  @Override
  public Optional<Job> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId)).map(this::deserialize);
  }

  @Override
  public List<Job> findByOwner(String ownerId, JobFilter filter) {
    return cache.asMap().values().stream()
        .map(this::deserialize)
        .filter(job -> ownerId.equals(job.getOwnerId()))
        .filter(filter::matches)
        .sorted(Comparator.comparing(Job::getCreatedAt).reversed())
        .limit(filter.limit())
        .toList();
  }

  @Override
  public long countByOwner(String ownerId) {
    return cache.asMap().values().stream()
        .map(this::deserialize)
        .filter(job -> ownerId.equals(job.getOwnerId()))
        .count();
  }

  @Override
  public long countByOwnerAndType(String ownerId, JobType type) {
    return cache.asMap().values().stream()
        .map(this::deserialize)
        .filter(job -> ownerId.equals(job.getOwnerId()) && job.getType() == type)
        .count();
  }

  private String serialize(Job job) {
    try {
      return objectMapper.writeValueAsString(job);
    } catch (JsonProcessingException e) {
      throw new JobStoreException("Failed to serialize job " + job.getId(), e);
    }
  }

  private Job deserialize(String json) {
    try {
      return objectMapper.readValue(json, Job.class);
    } catch (JsonProcessingException e) {
      throw new JobStoreException("Failed to read stored job", e);
    }
  }
}
