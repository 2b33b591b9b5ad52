package com.scholary.pipeline.job;

/** Thrown when job state cannot be written to or read from the store. */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message) {
    super(message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
