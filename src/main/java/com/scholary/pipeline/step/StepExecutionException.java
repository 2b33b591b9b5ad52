package com.scholary.pipeline.step;

/**
 * A step failed while calling its backend or persisting its result.
 *
 * <p>The message is the cause's message so it can be reported to the caller as is.
 */
public class StepExecutionException extends RuntimeException {

  private final String step;

  public StepExecutionException(String step, Throwable cause) {
    super(describe(cause), cause);
    this.step = step;
  }

  public String getStep() {
    return step;
  }

  static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}
