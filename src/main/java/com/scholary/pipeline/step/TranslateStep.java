package com.scholary.pipeline.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.capability.CapabilityResult;
import com.scholary.pipeline.capability.TranslateOptions;
import com.scholary.pipeline.capability.TranslationCapability;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.document.DocumentStore;
import com.scholary.pipeline.job.JobParams;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.result.ResultLog;
import com.scholary.pipeline.result.StepNames;
import org.springframework.stereotype.Component;

/**
 * Translates the most processed text available. Candidates in order: this run's summary, this
 * run's transcript, the document's text, the seeded input text. The first non-blank one wins.
 */
@Component
public class TranslateStep extends AbstractStepExecutor {

  private final TranslationCapability translationCapability;

  public TranslateStep(
      JobStore jobStore, DocumentStore documentStore, TranslationCapability translationCapability) {
    super(jobStore, documentStore);
    this.translationCapability = translationCapability;
  }

  @Override
  public String name() {
    return StepNames.TRANSLATE;
  }

  @Override
  protected ObjectNode run(StepContext context) {
    ResultLog log = context.resultLog();
    String source =
        completedText(log, StepNames.SUMMARIZE, "summary")
            .or(() -> completedText(log, StepNames.TRANSCRIBE, "text"))
            .or(
                () ->
                    context
                        .optionalDocument()
                        .map(Document::getTextContent)
                        .flatMap(AbstractStepExecutor::nonBlank))
            .or(() -> completedText(log, StepNames.INPUT_TEXT, "text"))
            .orElseThrow(() -> new NoSourceTextException("No text available to translate"));

    JobParams params = context.params();
    CapabilityResult result =
        translationCapability.translate(
            source, new TranslateOptions(params.targetLang(), params.sourceLang()));

    Document document = context.document();
    if (document != null) {
      document.setTranslatedText(result.text());
      if (result.language() != null) {
        document.setSourceLanguage(result.language());
      }
      saveDocument(document);
    }

    ObjectNode output = JsonNodeFactory.instance.objectNode();
    output.put("translation", result.text());
    output.put("source_lang", result.language());
    output.put("target_lang", params.targetLang());
    output.set("raw", orNull(result.raw()));
    return output;
  }
}
