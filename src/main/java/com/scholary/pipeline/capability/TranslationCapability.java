package com.scholary.pipeline.capability;

/** Translation backend. */
public interface TranslationCapability {

  /**
   * Translate a text. The result's language, when present, is the detected source language.
   *
   * @throws CapabilityException if translation fails
   */
  CapabilityResult translate(String text, TranslateOptions options);
}
