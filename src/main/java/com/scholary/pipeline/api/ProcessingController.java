package com.scholary.pipeline.api;

import com.scholary.pipeline.api.ProcessingResponse.Field;
import com.scholary.pipeline.service.ProcessingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for processing jobs.
 *
 * <p>Jobs run synchronously: the response carries the finished job. A job that failed is answered
 * with 500 and its error. The caller is identified by the {@value #OWNER_HEADER} header.
 */
@RestController
@RequestMapping("/api/processing")
@Tag(name = "Processing", description = "Transcription, summarization and translation jobs")
public class ProcessingController {

  static final String OWNER_HEADER = "X-User-Id";

  private final ProcessingService processingService;

  public ProcessingController(ProcessingService processingService) {
    this.processingService = processingService;
  }

  @PostMapping("/start")
  @Operation(summary = "Run a composite job", description = "Run the given operations in order")
  public ResponseEntity<ProcessingResponse> start(
      @RequestHeader(OWNER_HEADER) String ownerId, @RequestBody StartProcessingRequest request) {
    return respond(ProcessingResponse.fromJob(processingService.startComposite(ownerId, request)));
  }

  @PostMapping("/transcribe")
  @Operation(
      summary = "Transcribe a document",
      description = "Returns the stored transcript unless force is set")
  public ResponseEntity<ProcessingResponse> transcribe(
      @RequestHeader(OWNER_HEADER) String ownerId, @RequestBody TranscribeRequest request) {
    return respond(
        ProcessingResponse.fromOutcome(
            processingService.transcribe(ownerId, request), Field.TRANSCRIPTION));
  }

  @PostMapping("/summarize")
  @Operation(
      summary = "Summarize a document or text",
      description = "Returns the stored summary unless force is set")
  public ResponseEntity<ProcessingResponse> summarize(
      @RequestHeader(OWNER_HEADER) String ownerId, @RequestBody SummarizeRequest request) {
    return respond(
        ProcessingResponse.fromOutcome(processingService.summarize(ownerId, request), Field.SUMMARY));
  }

  @PostMapping("/translate")
  @Operation(
      summary = "Translate a document or text",
      description = "Returns the stored translation unless force is set")
  public ResponseEntity<ProcessingResponse> translate(
      @RequestHeader(OWNER_HEADER) String ownerId, @RequestBody TranslateRequest request) {
    return respond(
        ProcessingResponse.fromOutcome(
            processingService.translate(ownerId, request), Field.TRANSLATION));
  }

  @PostMapping("/text/summarize")
  @Operation(summary = "Summarize text without a document")
  public ResponseEntity<ProcessingResponse> summarizeText(
      @RequestHeader(OWNER_HEADER) String ownerId, @RequestBody TextSummarizeRequest request) {
    return respond(
        ProcessingResponse.fromOutcome(
            processingService.summarizeText(ownerId, request), Field.SUMMARY));
  }

  @PostMapping("/text/translate")
  @Operation(summary = "Translate text without a document")
  public ResponseEntity<ProcessingResponse> translateText(
      @RequestHeader(OWNER_HEADER) String ownerId, @RequestBody TextTranslateRequest request) {
    return respond(
        ProcessingResponse.fromOutcome(
            processingService.translateText(ownerId, request), Field.TRANSLATION));
  }

  @GetMapping("/jobs")
  @Operation(
      summary = "List jobs",
      description = "Newest first; document_id=null lists jobs without a document")
  public List<JobResponse> listJobs(
      @RequestHeader(OWNER_HEADER) String ownerId,
      @RequestParam(name = "document_id", required = false) String documentId,
      @RequestParam(name = "type", required = false) String type,
      @RequestParam(name = "limit", required = false) Integer limit) {
    return processingService.listJobs(ownerId, documentId, type, limit).stream()
        .map(JobResponse::summary)
        .toList();
  }

  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get a job with its result log")
  public JobResponse getJob(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String jobId) {
    return JobResponse.detail(processingService.getJob(ownerId, jobId));
  }

  @PostMapping("/jobs/{id}/retry")
  @Operation(
      summary = "Retry a failed job",
      description = "Completed steps are skipped; the failed step runs again")
  public ResponseEntity<ProcessingResponse> retry(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String jobId) {
    return respond(ProcessingResponse.fromJob(processingService.retry(ownerId, jobId)));
  }

  @GetMapping("/documents/{id}/jobs")
  @Operation(summary = "List the jobs of a document")
  public List<JobResponse> listDocumentJobs(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable("id") String documentId) {
    return processingService.listDocumentJobs(ownerId, documentId).stream()
        .map(JobResponse::summary)
        .toList();
  }

  @GetMapping("/dashboard/summary")
  @Operation(summary = "Counts and recent activity")
  public DashboardResponse dashboard(@RequestHeader(OWNER_HEADER) String ownerId) {
    return DashboardResponse.from(processingService.dashboard(ownerId));
  }

  private static ResponseEntity<ProcessingResponse> respond(ProcessingResponse response) {
    if (response.isFailed()) {
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    return ResponseEntity.ok(response);
  }
}
