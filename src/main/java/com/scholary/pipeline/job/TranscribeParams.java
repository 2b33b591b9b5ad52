package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.pipeline.result.StepNames;
import java.util.List;

/** Parameters of a single transcription job. */
public record TranscribeParams(@JsonProperty("force") boolean force) implements JobParams {

  @Override
  public List<String> operations() {
    return List.of(StepNames.TRANSCRIBE);
  }
}
