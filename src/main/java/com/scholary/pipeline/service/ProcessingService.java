package com.scholary.pipeline.service;

import com.scholary.pipeline.api.StartProcessingRequest;
import com.scholary.pipeline.api.SummarizeRequest;
import com.scholary.pipeline.api.TextSummarizeRequest;
import com.scholary.pipeline.api.TextTranslateRequest;
import com.scholary.pipeline.api.TranscribeRequest;
import com.scholary.pipeline.api.TranslateRequest;
import com.scholary.pipeline.config.PipelineProperties;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.document.DocumentStore;
import com.scholary.pipeline.job.CompositeParams;
import com.scholary.pipeline.job.InputSnapshot;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobFilter;
import com.scholary.pipeline.job.JobParams;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.job.JobType;
import com.scholary.pipeline.job.SummarizeParams;
import com.scholary.pipeline.job.TranscribeParams;
import com.scholary.pipeline.job.TranslateParams;
import com.scholary.pipeline.result.StepNames;
import com.scholary.pipeline.result.StepRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Processing features on top of the orchestrator: request checks, the stored-value shortcut for
 * single-step requests, and job lookups.
 *
 * <p>All lookups are scoped to the owner; another owner's job or document reads as not found.
 */
@Service
public class ProcessingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingService.class);

  static final int RECENT_DOCUMENTS = 10;
  static final int RECENT_JOBS = 15;

  private final JobOrchestrator orchestrator;
  private final JobStore jobStore;
  private final DocumentStore documentStore;
  private final PipelineProperties properties;

  public ProcessingService(
      JobOrchestrator orchestrator,
      JobStore jobStore,
      DocumentStore documentStore,
      PipelineProperties properties) {
    this.orchestrator = orchestrator;
    this.jobStore = jobStore;
    this.documentStore = documentStore;
    this.properties = properties;
  }

  /**
   * Create and run a composite job.
   *
   * @throws InvalidRequestException if the operation list is missing, empty or has empty entries
   * @throws NotFoundException if the document is not the owner's
   */
  public Job startComposite(String ownerId, StartProcessingRequest request) {
    if (request.operations() == null || request.operations().isEmpty()) {
      throw new InvalidRequestException("operations must be a non-empty list");
    }
    if (request.operations().stream().anyMatch(op -> op == null || op.isBlank())) {
      throw new InvalidRequestException("operations must not contain empty entries");
    }
    Document document = findDocument(ownerId, request.documentId()).orElse(null);

    LOGGER.info(
        "Composite request: operations={}, documentId={}, hasText={}",
        request.operations(),
        request.documentId(),
        request.text() != null);

    JobParams params =
        new CompositeParams(
            request.operations(), mode(request.mode()), targetLang(request.targetLang()));
    Job job =
        orchestrator.create(
            ownerId,
            JobType.COMPOSITE,
            document == null ? null : document.getId(),
            params,
            snapshot(request.documentId(), request.text(), request.filePath()));
    return orchestrator.run(job, document, request.text());
  }

  /**
   * Transcribe a document, or return its stored transcript unless forced.
   *
   * @throws InvalidRequestException if no document id is given
   */
  public ProcessingOutcome transcribe(String ownerId, TranscribeRequest request) {
    if (request.documentId() == null || request.documentId().isBlank()) {
      throw new InvalidRequestException("document_id required");
    }
    Document document = requireDocument(ownerId, request.documentId());

    if (!request.force() && hasText(document.getTextContent())) {
      LOGGER.info("Returning existing transcription: documentId={}", document.getId());
      return ProcessingOutcome.existing(document.getTextContent());
    }

    Job job =
        orchestrator.create(
            ownerId,
            JobType.TRANSCRIBE,
            document.getId(),
            new TranscribeParams(request.force()),
            snapshot(document.getId(), null, null));
    return outcome(orchestrator.run(job, document, null), StepNames.TRANSCRIBE, "transcription");
  }

  /** Summarize a document and/or ad-hoc text, or return the stored summary unless forced. */
  public ProcessingOutcome summarize(String ownerId, SummarizeRequest request) {
    Document document = findDocument(ownerId, request.documentId()).orElse(null);

    if (document != null && !request.force() && hasText(document.getSummary())) {
      LOGGER.info("Returning existing summary: documentId={}", document.getId());
      return ProcessingOutcome.existing(document.getSummary());
    }

    Job job =
        orchestrator.create(
            ownerId,
            JobType.SUMMARIZE,
            document == null ? null : document.getId(),
            new SummarizeParams(mode(request.mode()), request.force()),
            snapshot(request.documentId(), request.text(), null));
    return outcome(orchestrator.run(job, document, request.text()), StepNames.SUMMARIZE, "summary");
  }

  /** Translate a document and/or ad-hoc text, or return the stored translation unless forced. */
  public ProcessingOutcome translate(String ownerId, TranslateRequest request) {
    Document document = findDocument(ownerId, request.documentId()).orElse(null);

    if (document != null && !request.force() && hasText(document.getTranslatedText())) {
      LOGGER.info("Returning existing translation: documentId={}", document.getId());
      return ProcessingOutcome.existing(document.getTranslatedText());
    }

    Job job =
        orchestrator.create(
            ownerId,
            JobType.TRANSLATE,
            document == null ? null : document.getId(),
            new TranslateParams(
                targetLang(request.targetLang()), request.sourceLang(), request.force()),
            snapshot(request.documentId(), request.text(), null));
    return outcome(
        orchestrator.run(job, document, request.text()), StepNames.TRANSLATE, "translation");
  }

  /** Summarize text that belongs to no document. */
  public ProcessingOutcome summarizeText(String ownerId, TextSummarizeRequest request) {
    String text = requireText(request.text());
    Job job =
        orchestrator.create(
            ownerId,
            JobType.SUMMARIZE,
            null,
            new SummarizeParams(mode(request.mode()), false),
            snapshot(null, text, null));
    return outcome(orchestrator.run(job, null, text), StepNames.SUMMARIZE, "summary");
  }

  /** Translate text that belongs to no document. */
  public ProcessingOutcome translateText(String ownerId, TextTranslateRequest request) {
    String text = requireText(request.text());
    Job job =
        orchestrator.create(
            ownerId,
            JobType.TRANSLATE,
            null,
            new TranslateParams(targetLang(request.targetLang()), request.sourceLang(), false),
            snapshot(null, text, null));
    return outcome(orchestrator.run(job, null, text), StepNames.TRANSLATE, "translation");
  }

  public Job getJob(String ownerId, String jobId) {
    return jobStore
        .findById(jobId)
        .filter(job -> ownerId.equals(job.getOwnerId()))
        .orElseThrow(() -> new NotFoundException("not found"));
  }

  /**
   * List the owner's jobs, newest first.
   *
   * @param documentId a document id, {@code "null"} for jobs without a document, or null for all
   * @param type a job type value; an unknown type matches nothing
   * @param limit maximum number of jobs, defaults to {@value JobFilter#DEFAULT_LIMIT}
   */
  public List<Job> listJobs(String ownerId, String documentId, String type, Integer limit) {
    JobType jobType = null;
    if (type != null && !type.isBlank()) {
      Optional<JobType> parsed = JobType.fromValue(type);
      if (parsed.isEmpty()) {
        return List.of();
      }
      jobType = parsed.get();
    }

    boolean textOnly = "null".equals(documentId);
    JobFilter filter =
        new JobFilter(
            textOnly ? null : documentId, textOnly, jobType, limit == null ? 0 : limit);
    return jobStore.findByOwner(ownerId, filter);
  }

  /** All jobs of one of the owner's documents, newest first. */
  public List<Job> listDocumentJobs(String ownerId, String documentId) {
    Document document =
        documentStore
            .findByIdAndOwner(documentId, ownerId)
            .orElseThrow(() -> new NotFoundException("not found"));
    return jobStore.findByOwner(ownerId, JobFilter.forDocument(document.getId()));
  }

  /**
   * Run a failed job again. Steps that completed last time are not repeated.
   *
   * @throws IllegalStateException if the job already completed
   */
  public Job retry(String ownerId, String jobId) {
    Job job = getJob(ownerId, jobId);
    return orchestrator.resume(job);
  }

  public DashboardSummary dashboard(String ownerId) {
    Map<String, Long> byType = new LinkedHashMap<>();
    for (JobType type : JobType.values()) {
      byType.put(type.value(), jobStore.countByOwnerAndType(ownerId, type));
    }
    return new DashboardSummary(
        documentStore.countByOwner(ownerId),
        jobStore.countByOwner(ownerId),
        byType,
        documentStore.findRecentByOwner(ownerId, RECENT_DOCUMENTS),
        jobStore.findByOwner(ownerId, JobFilter.recent(RECENT_JOBS)));
  }

  private Optional<Document> findDocument(String ownerId, String documentId) {
    if (documentId == null || documentId.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(requireDocument(ownerId, documentId));
  }

  private Document requireDocument(String ownerId, String documentId) {
    return documentStore
        .findByIdAndOwner(documentId, ownerId)
        .orElseThrow(() -> new NotFoundException("document not found"));
  }

  private InputSnapshot snapshot(String documentId, String text, String filePath) {
    return InputSnapshot.of(documentId, text, filePath, properties.snippetMaxChars(), Instant.now());
  }

  private String mode(String requested) {
    return hasText(requested) ? requested : properties.defaultMode();
  }

  private String targetLang(String requested) {
    return hasText(requested) ? requested : properties.defaultTargetLang();
  }

  private static String requireText(String text) {
    String trimmed = text == null ? "" : text.strip();
    if (trimmed.isEmpty()) {
      throw new InvalidRequestException("text is required");
    }
    return trimmed;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static ProcessingOutcome outcome(Job job, String step, String field) {
    String value =
        Optional.ofNullable(job.getResult())
            .flatMap(log -> log.findCompleted(step))
            .flatMap(record -> primaryValue(record, field))
            .orElse(null);
    return new ProcessingOutcome(job, value);
  }

  private static Optional<String> primaryValue(StepRecord record, String field) {
    return record.outputText(field).or(() -> record.outputText("text"));
  }
}
