package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Parameters of a multi-step job: the ordered operation list plus step options. */
public record CompositeParams(
    @JsonProperty("operations") List<String> operations,
    @JsonProperty("mode") String mode,
    @JsonProperty("target_lang") String targetLang)
    implements JobParams {

  public CompositeParams {
    operations = operations == null ? List.of() : List.copyOf(operations);
    mode = JobParams.normalizeMode(mode);
    targetLang = JobParams.normalizeTargetLang(targetLang);
  }
}
