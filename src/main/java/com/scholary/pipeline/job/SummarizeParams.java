package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.pipeline.result.StepNames;
import java.util.List;

/** Parameters of a single summarization job. */
public record SummarizeParams(
    @JsonProperty("mode") String mode, @JsonProperty("force") boolean force)
    implements JobParams {

  public SummarizeParams {
    mode = JobParams.normalizeMode(mode);
  }

  @Override
  public List<String> operations() {
    return List.of(StepNames.SUMMARIZE);
  }
}
