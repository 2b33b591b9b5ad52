package com.scholary.pipeline.capability;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class CapabilityResponsesTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void testNormalize_ScalarStringIsPrimaryText() {
    CapabilityResult result =
        CapabilityResponses.normalize(objectMapper.valueToTree("short summary"), ResponseShape.SUMMARY);

    assertThat(result.text()).isEqualTo("short summary");
    assertThat(result.language()).isNull();
    assertThat(result.raw().asText()).isEqualTo("short summary");
  }

  @Test
  void testNormalize_TranscriptionAliasesAndSegments() throws Exception {
    JsonNode payload =
        objectMapper.readTree(
            "{\"transcription\":\"hello world\",\"detected_language\":\"fr\","
                + "\"chunks\":[{\"text\":\"hello\"},{\"text\":\"world\"}]}");

    CapabilityResult result = CapabilityResponses.normalize(payload, ResponseShape.TRANSCRIPTION);

    assertThat(result.text()).isEqualTo("hello world");
    assertThat(result.language()).isEqualTo("fr");
    assertThat(result.segments()).hasSize(2);
    assertThat(result.raw()).isEqualTo(payload);
  }

  @Test
  void testNormalize_SegmentsOnlyResponseIsJoined() throws Exception {
    JsonNode payload =
        objectMapper.readTree(
            "{\"language\":\"en\",\"segments\":[{\"start\":0,\"text\":\" one \"},{\"start\":2,\"text\":\"two\"}]}");

    CapabilityResult result = CapabilityResponses.normalize(payload, ResponseShape.TRANSCRIPTION);

    assertThat(result.text()).isEqualTo("one two");
    assertThat(result.language()).isEqualTo("en");
  }

  @Test
  void testNormalize_RawKeyWinsOverWholePayload() throws Exception {
    JsonNode payload =
        objectMapper.readTree("{\"translation\":\"hola\",\"source_lang\":\"en\",\"raw\":{\"model\":\"m2m\"}}");

    CapabilityResult result = CapabilityResponses.normalize(payload, ResponseShape.TRANSLATION);

    assertThat(result.text()).isEqualTo("hola");
    assertThat(result.language()).isEqualTo("en");
    assertThat(result.raw().get("model").asText()).isEqualTo("m2m");
  }

  @Test
  void testNormalize_FallsBackToSecondAliasWhenFirstIsBlank() throws Exception {
    JsonNode payload = objectMapper.readTree("{\"summary\":\"  \",\"text\":\"fallback\"}");

    assertThat(CapabilityResponses.normalize(payload, ResponseShape.SUMMARY).text())
        .isEqualTo("fallback");
  }

  @Test
  void testNormalize_ArrayOfChunksIsJoined() throws Exception {
    JsonNode payload = objectMapper.readTree("[\"first part\", {\"summary\":\"second part\"}]");

    assertThat(CapabilityResponses.normalize(payload, ResponseShape.SUMMARY).text())
        .isEqualTo("first part second part");
  }

  @Test
  void testNormalize_NullPayloadGivesEmptyText() {
    CapabilityResult result = CapabilityResponses.normalize(null, ResponseShape.SUMMARY);

    assertThat(result.text()).isEmpty();
    assertThat(result.raw().isNull()).isTrue();
  }

  @Test
  void testNormalize_TranscriptionKeepsWholePayloadEvenWithRawKey() throws Exception {
    JsonNode payload =
        objectMapper.readTree("{\"text\":\"hello\",\"raw\":{\"model\":\"large-v3\"}}");

    CapabilityResult result = CapabilityResponses.normalize(payload, ResponseShape.TRANSCRIPTION);

    assertThat(result.text()).isEqualTo("hello");
    assertThat(result.raw()).isEqualTo(payload);
  }
}
