package com.scholary.pipeline.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.capability.CapabilityResult;
import com.scholary.pipeline.capability.SummarizationCapability;
import com.scholary.pipeline.capability.SummarizeOptions;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.document.DocumentStore;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.result.ResultLog;
import com.scholary.pipeline.result.StepNames;
import org.springframework.stereotype.Component;

/**
 * Summarizes the best available text: the document's text, else the transcript of this run, else
 * the seeded input text.
 */
@Component
public class SummarizeStep extends AbstractStepExecutor {

  private final SummarizationCapability summarizationCapability;

  public SummarizeStep(
      JobStore jobStore,
      DocumentStore documentStore,
      SummarizationCapability summarizationCapability) {
    super(jobStore, documentStore);
    this.summarizationCapability = summarizationCapability;
  }

  @Override
  public String name() {
    return StepNames.SUMMARIZE;
  }

  @Override
  protected ObjectNode run(StepContext context) {
    ResultLog log = context.resultLog();
    String source =
        context
            .optionalDocument()
            .map(Document::getTextContent)
            .flatMap(AbstractStepExecutor::nonBlank)
            .or(() -> completedText(log, StepNames.TRANSCRIBE, "text"))
            .or(() -> completedText(log, StepNames.INPUT_TEXT, "text"))
            .orElseThrow(() -> new NoSourceTextException("No text available to summarize"));

    String mode = context.params().mode();
    CapabilityResult result = summarizationCapability.summarize(source, new SummarizeOptions(mode));

    Document document = context.document();
    if (document != null) {
      document.setSummary(result.text());
      saveDocument(document);
    }

    ObjectNode output = JsonNodeFactory.instance.objectNode();
    output.put("summary", result.text());
    output.put("mode", mode);
    output.set("raw", orNull(result.raw()));
    return output;
  }
}
