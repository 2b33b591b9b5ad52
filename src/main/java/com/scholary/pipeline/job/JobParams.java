package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Locale;

/**
 * Caller-supplied configuration of a job, fixed once the job starts.
 *
 * <p>Each job type has its own variant; the variant is decoded once when the job is created and
 * read back through this interface by the orchestrator and the steps.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = CompositeParams.class, name = "composite"),
  @JsonSubTypes.Type(value = TranscribeParams.class, name = "transcribe"),
  @JsonSubTypes.Type(value = SummarizeParams.class, name = "summarize"),
  @JsonSubTypes.Type(value = TranslateParams.class, name = "translate")
})
public sealed interface JobParams
    permits CompositeParams, TranscribeParams, SummarizeParams, TranslateParams {

  String DEFAULT_MODE = "concise";
  String DEFAULT_TARGET_LANG = "en";

  /** Step names to run, in order. */
  List<String> operations();

  /** Summarizer mode. */
  default String mode() {
    return DEFAULT_MODE;
  }

  /** Translation target language. */
  default String targetLang() {
    return DEFAULT_TARGET_LANG;
  }

  /** Translation source language, null to let the backend detect it. */
  default String sourceLang() {
    return null;
  }

  static String normalizeMode(String mode) {
    return lowerOrDefault(mode, DEFAULT_MODE);
  }

  static String normalizeTargetLang(String targetLang) {
    return lowerOrDefault(targetLang, DEFAULT_TARGET_LANG);
  }

  private static String lowerOrDefault(String value, String fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return value.trim().toLowerCase(Locale.ROOT);
  }
}
