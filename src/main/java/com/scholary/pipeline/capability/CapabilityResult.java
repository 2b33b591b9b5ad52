package com.scholary.pipeline.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Normalized result of a capability call.
 *
 * @param text the primary text (transcript, summary or translation), never null
 * @param language detected language when the backend reports one
 * @param segments segment or chunk list when the backend reports one
 * @param raw the backend payload kept for audit
 */
public record CapabilityResult(String text, String language, JsonNode segments, JsonNode raw) {

  public CapabilityResult {
    text = text == null ? "" : text;
  }

  /** A plain text result with no metadata. */
  public static CapabilityResult ofText(String text) {
    return new CapabilityResult(text, null, null, TextNode.valueOf(text));
  }
}
