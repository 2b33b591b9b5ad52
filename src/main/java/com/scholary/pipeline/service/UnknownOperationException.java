package com.scholary.pipeline.service;

import com.scholary.pipeline.step.InputException;

/** An operation list named a step that does not exist. */
public class UnknownOperationException extends InputException {

  public UnknownOperationException(String operation) {
    super("Unknown operation '" + operation + "'");
  }
}
