package com.scholary.pipeline.capability;

import java.util.List;

/**
 * Field aliases a backend may use for each part of its response. The first present, non-blank
 * alias wins.
 *
 * <p>{@code nestedRaw} lets a backend hand over its own audit payload under a {@code raw} key;
 * otherwise the whole response is kept.
 */
public record ResponseShape(
    List<String> textKeys,
    List<String> languageKeys,
    List<String> segmentKeys,
    boolean nestedRaw) {

  public static final ResponseShape TRANSCRIPTION =
      new ResponseShape(
          List.of("text", "transcription"),
          List.of("language", "detected_language"),
          List.of("segments", "chunks", "words"),
          false);

  public static final ResponseShape SUMMARY =
      new ResponseShape(List.of("summary", "text"), List.of(), List.of(), true);

  public static final ResponseShape TRANSLATION =
      new ResponseShape(
          List.of("translation", "text"),
          List.of("source_lang", "detected_source"),
          List.of(),
          true);
}
