package com.scholary.pipeline.step;

/** A step found no usable input among the document and the earlier steps. */
public class NoSourceTextException extends InputException {

  public NoSourceTextException(String message) {
    super(message);
  }
}
