package com.scholary.pipeline.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.pipeline.capability.CapabilityResponses;
import com.scholary.pipeline.capability.CapabilityResult;
import com.scholary.pipeline.capability.ResponseShape;
import com.scholary.pipeline.capability.TranscriptionCapability;
import com.scholary.pipeline.inference.HttpCapabilityClient;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the faster-whisper transcription API.
 *
 * <p>Stages the audio locally, uploads it as multipart/form-data and normalizes the answer. Older
 * deployments return only a segment list; its texts are joined into the transcript.
 */
@Component
public class WhisperTranscriptionClient extends HttpCapabilityClient
    implements TranscriptionCapability {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperTranscriptionClient.class);

  private final WhisperProperties properties;
  private final AudioSourceResolver audioSourceResolver;

  public WhisperTranscriptionClient(
      WhisperProperties properties,
      AudioSourceResolver audioSourceResolver,
      ObjectMapper objectMapper) {
    super(
        "transcribe",
        properties.connectTimeout(),
        properties.maxRetries(),
        properties.backoffMs(),
        objectMapper);
    this.properties = properties;
    this.audioSourceResolver = audioSourceResolver;

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public CapabilityResult transcribe(String sourceRef) {
    LOGGER.info("Transcribing audio: source={}", sourceRef);

    try (StagedAudio audio = audioSourceResolver.stage(sourceRef)) {
      CapabilityResult result =
          CapabilityResponses.normalize(
              execute(() -> buildRequest(audio.path())), ResponseShape.TRANSCRIPTION);

      LOGGER.info(
          "Transcription successful: chars={}, language={}",
          result.text().length(),
          result.language());
      return result;
    }
  }

  private HttpRequest buildRequest(Path audioFile) throws IOException {
    String boundary = UUID.randomUUID().toString();
    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Content-Type", "multipart/form-data; boundary=" + boundary)
        .POST(buildMultipartBody(audioFile, boundary))
        .build();
  }

  /**
   * Build a multipart/form-data body holding the audio file.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="audio.mp3"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String boundary) throws IOException {
    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    String head =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + filename
            + "\"\r\n"
            + "Content-Type: application/octet-stream\r\n\r\n";
    String tail = "\r\n--" + boundary + "--\r\n";

    byte[] prefix = head.getBytes(StandardCharsets.UTF_8);
    byte[] suffix = tail.getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }
}
