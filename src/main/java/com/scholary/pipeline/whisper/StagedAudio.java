package com.scholary.pipeline.whisper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A local audio file ready to upload. Files copied out of the object store are deleted on close;
 * caller-owned local files are left alone.
 */
public final class StagedAudio implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(StagedAudio.class);

  private final Path path;
  private final boolean temporary;

  private StagedAudio(Path path, boolean temporary) {
    this.path = path;
    this.temporary = temporary;
  }

  static StagedAudio local(Path path) {
    return new StagedAudio(path, false);
  }

  static StagedAudio temporary(Path path) {
    return new StagedAudio(path, true);
  }

  public Path path() {
    return path;
  }

  public boolean isTemporary() {
    return temporary;
  }

  @Override
  public void close() {
    if (!temporary) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete staged audio {}: {}", path, e.getMessage());
    }
  }
}
