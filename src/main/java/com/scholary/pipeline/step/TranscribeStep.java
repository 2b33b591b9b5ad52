package com.scholary.pipeline.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.capability.CapabilityResult;
import com.scholary.pipeline.capability.TranscriptionCapability;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.document.DocumentStore;
import com.scholary.pipeline.job.InputSnapshot;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.result.StepNames;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Transcribes the document's audio, or the audio reference in the job input when there is no
 * document. Writes the transcript (and the detected language) back to the document.
 */
@Component
public class TranscribeStep extends AbstractStepExecutor {

  private final TranscriptionCapability transcriptionCapability;

  public TranscribeStep(
      JobStore jobStore,
      DocumentStore documentStore,
      TranscriptionCapability transcriptionCapability) {
    super(jobStore, documentStore);
    this.transcriptionCapability = transcriptionCapability;
  }

  @Override
  public String name() {
    return StepNames.TRANSCRIBE;
  }

  @Override
  protected ObjectNode run(StepContext context) {
    String source =
        context
            .optionalDocument()
            .map(Document::getFilePath)
            .flatMap(AbstractStepExecutor::nonBlank)
            .or(() -> inputFilePath(context))
            .orElseThrow(() -> new NoSourceTextException("No audio source available to transcribe"));

    CapabilityResult result = transcriptionCapability.transcribe(source);

    Document document = context.document();
    if (document != null) {
      document.setTextContent(result.text());
      if (result.language() != null) {
        document.setLanguage(result.language());
      }
      saveDocument(document);
    }

    ObjectNode output = JsonNodeFactory.instance.objectNode();
    output.put("transcription", result.text());
    output.put("text", result.text());
    output.put("language", result.language());
    output.set("segments", orNull(result.segments()));
    output.set("raw", orNull(result.raw()));
    return output;
  }

  private static Optional<String> inputFilePath(StepContext context) {
    InputSnapshot input = context.job().getInput();
    return input == null ? Optional.empty() : nonBlank(input.filePath());
  }
}
