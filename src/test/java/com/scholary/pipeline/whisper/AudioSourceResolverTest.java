package com.scholary.pipeline.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.pipeline.capability.CapabilityException;
import com.scholary.pipeline.objectstore.ObjectStoreClient;
import com.scholary.pipeline.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.pipeline.objectstore.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AudioSourceResolverTest {

  @Mock private ObjectStoreClient objectStoreClient;

  @TempDir Path tempDir;

  private AudioSourceResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new AudioSourceResolver(objectStoreClient, tempDir.resolve("staging").toString());
  }

  @Test
  void testStage_LocalFileIsUsedInPlaceAndKept() throws Exception {
    Path audio = Files.write(tempDir.resolve("memo.wav"), new byte[] {1, 2, 3});

    try (StagedAudio staged = resolver.stage(audio.toString())) {
      assertThat(staged.path()).isEqualTo(audio);
      assertThat(staged.isTemporary()).isFalse();
    }

    assertThat(audio).exists();
    verifyNoInteractions(objectStoreClient);
  }

  @Test
  void testStage_MissingLocalFileFails() {
    assertThatThrownBy(() -> resolver.stage(tempDir.resolve("nope.mp3").toString()))
        .isInstanceOf(CapabilityException.class)
        .hasMessageContaining("Audio file not found");
  }

  @Test
  void testStage_ObjectReferenceIsDownloadedAndDeletedOnClose() throws Exception {
    when(objectStoreClient.getObjectMetadata("audio", "uploads/lecture.mp3"))
        .thenReturn(new ObjectMetadata(4, "audio/mpeg"));
    when(objectStoreClient.getObjectStream("audio", "uploads/lecture.mp3"))
        .thenReturn(new ByteArrayInputStream(new byte[] {9, 8, 7, 6}));

    Path stagedPath;
    try (StagedAudio staged = resolver.stage("s3://audio/uploads/lecture.mp3")) {
      stagedPath = staged.path();
      assertThat(staged.isTemporary()).isTrue();
      assertThat(stagedPath.getFileName().toString()).endsWith("lecture.mp3");
      assertThat(Files.readAllBytes(stagedPath)).containsExactly(9, 8, 7, 6);
    }

    assertThat(stagedPath).doesNotExist();
  }

  @Test
  void testStage_ObjectStoreErrorBecomesCapabilityError() {
    when(objectStoreClient.getObjectMetadata("audio", "missing.mp3"))
        .thenThrow(new ObjectStoreException("Object not found: audio/missing.mp3"));

    assertThatThrownBy(() -> resolver.stage("s3://audio/missing.mp3"))
        .isInstanceOf(CapabilityException.class)
        .hasMessageContaining("Object not found: audio/missing.mp3")
        .hasCauseInstanceOf(ObjectStoreException.class);
  }

  @Test
  void testStage_MalformedReferenceFails() {
    assertThatThrownBy(() -> resolver.stage("s3://bucket-only"))
        .isInstanceOf(CapabilityException.class)
        .hasMessageContaining("Malformed object reference");
  }
}
