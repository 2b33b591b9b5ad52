package com.scholary.pipeline.service;

/** A request is missing something it needs. Reported to the caller as a bad request. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
