package com.scholary.pipeline.result;

import java.util.Set;

/** Names of the steps a result log can hold. */
public final class StepNames {

  /** Synthetic seed step carrying caller-supplied text. */
  public static final String INPUT_TEXT = "input_text";

  public static final String TRANSCRIBE = "transcribe";
  public static final String SUMMARIZE = "summarize";
  public static final String TRANSLATE = "translate";

  /** Step names a caller may put in an operation list. */
  public static final Set<String> OPERATIONS = Set.of(TRANSCRIBE, SUMMARIZE, TRANSLATE);

  private StepNames() {}
}
