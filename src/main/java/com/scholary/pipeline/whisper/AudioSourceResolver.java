package com.scholary.pipeline.whisper;

import com.scholary.pipeline.capability.CapabilityException;
import com.scholary.pipeline.objectstore.ObjectReference;
import com.scholary.pipeline.objectstore.ObjectStoreClient;
import com.scholary.pipeline.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.pipeline.objectstore.ObjectStoreException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns an audio reference into a local file.
 *
 * <p>Object store references ({@code s3://bucket/key}) are downloaded into the temp directory;
 * anything else is taken as a local path and must exist.
 */
@Component
public class AudioSourceResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSourceResolver.class);

  private final ObjectStoreClient objectStoreClient;
  private final Path tempDir;

  public AudioSourceResolver(
      ObjectStoreClient objectStoreClient, @Value("${pipeline.temp-dir}") String tempDir) {
    this.objectStoreClient = objectStoreClient;
    this.tempDir = Paths.get(tempDir);

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /**
   * Stage an audio source for upload.
   *
   * @throws CapabilityException if the source cannot be found or downloaded
   */
  public StagedAudio stage(String sourceRef) {
    Optional<ObjectReference> reference;
    try {
      reference = ObjectReference.parse(sourceRef);
    } catch (IllegalArgumentException e) {
      throw new CapabilityException(e.getMessage(), e);
    }

    if (reference.isEmpty()) {
      Path local = Paths.get(sourceRef);
      if (!Files.isRegularFile(local)) {
        throw new CapabilityException("Audio file not found: " + sourceRef);
      }
      return StagedAudio.local(local);
    }

    ObjectReference ref = reference.get();
    Path target = tempDir.resolve(String.format("audio_%s_%s", UUID.randomUUID(), fileName(ref.key())));

    try {
      ObjectMetadata metadata = objectStoreClient.getObjectMetadata(ref.bucket(), ref.key());
      LOGGER.info(
          "Staging {} to {}: size={} bytes, contentType={}",
          ref,
          target,
          metadata.contentLength(),
          metadata.contentType());
    } catch (ObjectStoreException e) {
      throw new CapabilityException("Failed to stage audio " + ref + ": " + e.getMessage(), e);
    }

    try (InputStream stream = objectStoreClient.getObjectStream(ref.bucket(), ref.key())) {
      Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException | ObjectStoreException e) {
      throw new CapabilityException("Failed to stage audio " + ref + ": " + e.getMessage(), e);
    }
    return StagedAudio.temporary(target);
  }

  private static String fileName(String key) {
    int slash = key.lastIndexOf('/');
    return slash >= 0 ? key.substring(slash + 1) : key;
  }
}
