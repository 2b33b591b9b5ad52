package com.scholary.pipeline.capability;

/**
 * Options for a translation call.
 *
 * @param targetLang language to translate into
 * @param sourceLang language of the input, null to let the backend detect it
 */
public record TranslateOptions(String targetLang, String sourceLang) {}
