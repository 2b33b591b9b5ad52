package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.pipeline.result.StepNames;
import java.util.List;

/** Parameters of a single translation job. */
public record TranslateParams(
    @JsonProperty("target_lang") String targetLang,
    @JsonProperty("source_lang") String sourceLang,
    @JsonProperty("force") boolean force)
    implements JobParams {

  public TranslateParams {
    targetLang = JobParams.normalizeTargetLang(targetLang);
    sourceLang = sourceLang == null || sourceLang.isBlank() ? null : sourceLang.trim();
  }

  @Override
  public List<String> operations() {
    return List.of(StepNames.TRANSLATE);
  }
}
