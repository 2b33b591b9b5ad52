package com.scholary.pipeline.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Adapts backend payloads of varying shape into a {@link CapabilityResult}.
 *
 * <p>Backends answer with either a bare string, a list of chunks, or an object that names its
 * fields in one of several ways. All of that is absorbed here so the steps only ever see the
 * normalized form.
 */
public final class CapabilityResponses {

  private CapabilityResponses() {}

  public static CapabilityResult normalize(JsonNode payload, ResponseShape shape) {
    if (payload == null || payload.isNull() || payload.isMissingNode()) {
      return new CapabilityResult("", null, null, NullNode.getInstance());
    }
    if (payload.isTextual()) {
      return new CapabilityResult(payload.asText(), null, null, payload);
    }
    if (payload.isArray()) {
      return new CapabilityResult(joinChunks(payload, shape.textKeys()), null, null, payload);
    }
    if (!payload.isObject()) {
      return new CapabilityResult(payload.asText(), null, null, payload);
    }

    JsonNode segments = firstContainer(payload, shape.segmentKeys());
    String text = firstText(payload, shape.textKeys());
    if (text == null && segments != null && segments.isArray()) {
      // segments-only responses carry the transcript in the segment texts
      text = joinChunks(segments, shape.textKeys());
    }
    JsonNode raw = shape.nestedRaw() && payload.hasNonNull("raw") ? payload.get("raw") : payload;
    return new CapabilityResult(text, firstText(payload, shape.languageKeys()), segments, raw);
  }

  private static String firstText(JsonNode payload, List<String> keys) {
    for (String key : keys) {
      JsonNode value = payload.get(key);
      if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  private static JsonNode firstContainer(JsonNode payload, List<String> keys) {
    for (String key : keys) {
      JsonNode value = payload.get(key);
      if (value != null && value.isContainerNode()) {
        return value;
      }
    }
    return null;
  }

  private static String joinChunks(JsonNode chunks, List<String> textKeys) {
    List<String> parts = new ArrayList<>();
    for (JsonNode chunk : chunks) {
      String part = chunk.isObject() ? firstText(chunk, textKeys) : chunk.asText();
      if (part != null && !part.isBlank()) {
        parts.add(part.trim());
      }
    }
    return String.join(" ", parts);
  }
}
