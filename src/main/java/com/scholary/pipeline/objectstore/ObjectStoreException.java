package com.scholary.pipeline.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: a missing object or bad credentials cannot be fixed by the caller, and the step
 * that triggered the read records the failure.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
