package com.scholary.pipeline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.pipeline.capability.CapabilityException;
import com.scholary.pipeline.capability.CapabilityResult;
import com.scholary.pipeline.capability.SummarizationCapability;
import com.scholary.pipeline.capability.TranscriptionCapability;
import com.scholary.pipeline.capability.TranslationCapability;
import com.scholary.pipeline.document.CaffeineDocumentStore;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.job.CaffeineJobStore;
import com.scholary.pipeline.job.CompositeParams;
import com.scholary.pipeline.job.InputSnapshot;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobParams;
import com.scholary.pipeline.job.JobStatus;
import com.scholary.pipeline.job.JobType;
import com.scholary.pipeline.job.SummarizeParams;
import com.scholary.pipeline.result.OverallStatus;
import com.scholary.pipeline.result.StepNames;
import com.scholary.pipeline.result.StepRecord;
import com.scholary.pipeline.result.StepStatus;
import com.scholary.pipeline.step.InputTextStep;
import com.scholary.pipeline.step.SummarizeStep;
import com.scholary.pipeline.step.TranscribeStep;
import com.scholary.pipeline.step.TranslateStep;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Runs real steps and stores against mocked backends. */
@ExtendWith(MockitoExtension.class)
class JobOrchestratorTest {

  @Mock private TranscriptionCapability transcriber;
  @Mock private SummarizationCapability summarizer;
  @Mock private TranslationCapability translator;

  private CaffeineJobStore jobStore;
  private CaffeineDocumentStore documentStore;
  private JobOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    jobStore = new CaffeineJobStore(new ObjectMapper().findAndRegisterModules(), 100, 60);
    documentStore = new CaffeineDocumentStore(100);
    orchestrator =
        new JobOrchestrator(
            jobStore,
            documentStore,
            new InputTextStep(jobStore),
            List.of(
                new TranscribeStep(jobStore, documentStore, transcriber),
                new SummarizeStep(jobStore, documentStore, summarizer),
                new TranslateStep(jobStore, documentStore, translator)));
  }

  @Test
  void testCreate_StoresPendingJobWithoutLog() {
    Job job = create(JobType.COMPOSITE, null, composite("summarize"), null);

    Job stored = jobStore.findById(job.getId()).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(JobStatus.PENDING);
    assertThat(stored.getResult()).isNull();
    assertThat(stored.getFinishedAt()).isNull();
  }

  @Test
  void testRun_FullPipelineCompletesAndUpdatesDocument() {
    Document document = storedDocument(null);
    when(transcriber.transcribe("s3://audio/lecture.mp3"))
        .thenReturn(new CapabilityResult("the lecture", "en", null, null));
    when(summarizer.summarize(eq("the lecture"), any())).thenReturn(CapabilityResult.ofText("gist"));
    when(translator.translate(eq("gist"), any()))
        .thenReturn(new CapabilityResult("l'essentiel", "en", null, null));

    Job job =
        create(JobType.COMPOSITE, document.getId(), composite("transcribe", "summarize", "translate"), null);
    Job result = orchestrator.run(job, document, null);

    assertThat(result.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(result.getFinishedAt()).isNotNull();
    assertThat(result.getError()).isNull();

    Job stored = jobStore.findById(job.getId()).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(stored.getResult().getOverallStatus()).isEqualTo(OverallStatus.COMPLETED);
    assertThat(stored.getResult().getSteps())
        .extracting(StepRecord::name)
        .containsExactly(StepNames.TRANSCRIBE, StepNames.SUMMARIZE, StepNames.TRANSLATE);
    assertThat(stored.getResult().getSteps()).allMatch(StepRecord::isCompleted);

    Document updated = documentStore.findById(document.getId()).orElseThrow();
    assertThat(updated.getTextContent()).isEqualTo("the lecture");
    assertThat(updated.getLanguage()).isEqualTo("en");
    assertThat(updated.getSummary()).isEqualTo("gist");
    assertThat(updated.getTranslatedText()).isEqualTo("l'essentiel");
  }

  @Test
  void testRun_StepFailureKeepsPartialLogAndDocumentChanges() {
    Document document = storedDocument(null);
    when(transcriber.transcribe(anyString())).thenReturn(CapabilityResult.ofText("the lecture"));
    when(translator.translate(anyString(), any()))
        .thenThrow(new CapabilityException("translate failed after 3 attempts"));

    Job job = create(JobType.COMPOSITE, document.getId(), composite("transcribe", "translate"), null);
    Job result = orchestrator.run(job, document, null);

    assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(result.getError()).isEqualTo("translate failed after 3 attempts");

    Job stored = jobStore.findById(job.getId()).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(stored.getFinishedAt()).isNotNull();
    assertThat(stored.getResult().getOverallStatus()).isEqualTo(OverallStatus.RUNNING);
    assertThat(stored.getResult().findCompleted(StepNames.TRANSCRIBE)).isPresent();
    StepRecord translate = stored.getResult().find(StepNames.TRANSLATE).orElseThrow();
    assertThat(translate.status()).isEqualTo(StepStatus.FAILED);
    assertThat(translate.outputText("error")).contains("translate failed after 3 attempts");
    assertThat(stored.getResult().getErrors())
        .singleElement()
        .satisfies(e -> assertThat(e.error()).isEqualTo("translate failed after 3 attempts"));

    assertThat(documentStore.findById(document.getId()).orElseThrow().getTextContent())
        .isEqualTo("the lecture");
  }

  @Test
  void testRun_UnknownOperationFailsBeforeAnyStep() {
    Job job = create(JobType.COMPOSITE, null, composite("summarize", "quiz"), null);

    Job result = orchestrator.run(job, null, "some text");

    assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(result.getError()).isEqualTo("Unknown operation 'quiz'");
    assertThat(result.getResult().getSteps()).isEmpty();
    verifyNoInteractions(summarizer);
  }

  @Test
  void testRun_SummarizeWithoutAnySourceFailsWithInputError() {
    Job job = create(JobType.SUMMARIZE, null, new SummarizeParams(null, false), null);

    Job result = orchestrator.run(job, null, null);

    assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(result.getError()).isEqualTo("No text available to summarize");
    verifyNoInteractions(summarizer);
  }

  @Test
  void testRun_AdHocTextIsSeededForTextSteps() {
    when(summarizer.summarize(eq("please summarize me"), any()))
        .thenReturn(CapabilityResult.ofText("done"));

    Job job = create(JobType.COMPOSITE, null, composite("summarize"), "please summarize me");
    Job result = orchestrator.run(job, null, "please summarize me");

    assertThat(result.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(result.getResult().getSteps())
        .extracting(StepRecord::name)
        .containsExactly(StepNames.INPUT_TEXT, StepNames.SUMMARIZE);
  }

  @Test
  void testRun_AdHocTextIsNotSeededWhenTranscribing() {
    when(transcriber.transcribe(anyString())).thenReturn(CapabilityResult.ofText("spoken"));
    when(summarizer.summarize(eq("spoken"), any())).thenReturn(CapabilityResult.ofText("s"));
    Document document = storedDocument(null);

    Job job =
        create(JobType.COMPOSITE, document.getId(), composite("transcribe", "summarize"), "typed");
    Job result = orchestrator.run(job, document, "typed");

    assertThat(result.getResult().find(StepNames.INPUT_TEXT)).isEmpty();
    assertThat(result.getStatus()).isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  void testResume_SkipsCompletedStepsAndRetriesFailedOne() {
    Document document = storedDocument(null);
    when(transcriber.transcribe(anyString())).thenReturn(CapabilityResult.ofText("the lecture"));
    when(summarizer.summarize(anyString(), any()))
        .thenThrow(new CapabilityException("summarizer down"))
        .thenReturn(CapabilityResult.ofText("gist"));

    Job job = create(JobType.COMPOSITE, document.getId(), composite("transcribe", "summarize"), null);
    assertThat(orchestrator.run(job, document, null).getStatus()).isEqualTo(JobStatus.FAILED);

    Job stored = jobStore.findById(job.getId()).orElseThrow();
    Job resumed = orchestrator.resume(stored);

    assertThat(resumed.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(resumed.getError()).isNull();
    assertThat(resumed.getResult().getSteps())
        .extracting(StepRecord::name)
        .containsExactly(StepNames.TRANSCRIBE, StepNames.SUMMARIZE);
    assertThat(resumed.getResult().getErrors()).hasSize(1);
    verify(transcriber).transcribe(anyString());
  }

  @Test
  void testResume_CompletedJobIsRejected() {
    when(summarizer.summarize(anyString(), any())).thenReturn(CapabilityResult.ofText("s"));
    Job job = create(JobType.SUMMARIZE, null, new SummarizeParams(null, false), "text");
    orchestrator.run(job, null, "text");

    Job stored = jobStore.findById(job.getId()).orElseThrow();
    assertThatThrownBy(() -> orchestrator.resume(stored)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void testRun_RerunOfCompletedLogDoesNotCallBackendsAgain() {
    when(summarizer.summarize(anyString(), any())).thenReturn(CapabilityResult.ofText("s"));
    Job job = create(JobType.COMPOSITE, null, composite("summarize"), "text");
    orchestrator.run(job, null, "text");

    job.setStatus(JobStatus.FAILED);
    Job rerun = orchestrator.run(job, null, "text");

    assertThat(rerun.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(rerun.getResult().getSteps())
        .extracting(StepRecord::name)
        .containsExactly(StepNames.INPUT_TEXT, StepNames.SUMMARIZE);
    verify(summarizer).summarize(anyString(), any());
    verify(translator, never()).translate(anyString(), any());
  }

  private Job create(JobType type, String documentId, JobParams params, String text) {
    return orchestrator.create(
        "alice", type, documentId, params, InputSnapshot.of(documentId, text, null, 1000, Instant.now()));
  }

  private Document storedDocument(String textContent) {
    Document document = new Document("doc-1", "alice", "lecture.mp3", "s3://audio/lecture.mp3");
    document.setTextContent(textContent);
    documentStore.save(document);
    return document;
  }

  private static CompositeParams composite(String... operations) {
    return new CompositeParams(List.of(operations), null, null);
  }
}
