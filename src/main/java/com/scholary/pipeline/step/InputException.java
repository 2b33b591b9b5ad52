package com.scholary.pipeline.step;

/**
 * A job cannot proceed because of what it was given, as opposed to a backend failure. Fails the
 * job like any other step error.
 */
public class InputException extends RuntimeException {

  public InputException(String message) {
    super(message);
  }
}
