package com.scholary.pipeline.capability;

/**
 * Exception thrown when an inference backend call fails.
 *
 * <p>This covers network failures, non-success responses and payloads that cannot be read.
 */
public class CapabilityException extends RuntimeException {

  public CapabilityException(String message) {
    super(message);
  }

  public CapabilityException(String message, Throwable cause) {
    super(message, cause);
  }
}
