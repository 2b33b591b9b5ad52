package com.scholary.pipeline.service;

/** The requested job or document does not exist or belongs to another owner. */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
