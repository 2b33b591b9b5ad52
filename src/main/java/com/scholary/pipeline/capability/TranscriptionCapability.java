package com.scholary.pipeline.capability;

/** Speech-to-text backend. */
public interface TranscriptionCapability {

  /**
   * Transcribe an audio source.
   *
   * @param sourceRef a local path or an object store reference ({@code s3://bucket/key})
   * @return the transcript
   * @throws CapabilityException if transcription fails
   */
  CapabilityResult transcribe(String sourceRef);
}
