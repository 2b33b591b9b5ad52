package com.scholary.pipeline.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.job.InputSnapshot;
import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobParams;
import com.scholary.pipeline.job.JobType;
import com.scholary.pipeline.result.ResultLog;
import com.scholary.pipeline.result.StepRecord;
import java.time.Instant;

/** Builders shared by the step tests. */
final class StepFixtures {

  private StepFixtures() {}

  static Job runningJob(JobType type, JobParams params, InputSnapshot input) {
    Job job = new Job("job-1", "alice", type, null, params, input);
    job.setResult(ResultLog.init());
    return job;
  }

  static Document document(String textContent) {
    Document document = new Document("doc-1", "alice", "lecture.mp3", "s3://audio/lecture.mp3");
    document.setTextContent(textContent);
    return document;
  }

  static void completed(Job job, String step, String field, String value) {
    ObjectNode output = JsonNodeFactory.instance.objectNode();
    output.put(field, value);
    job.getResult().upsert(StepRecord.running(step, Instant.now()).completed(output, Instant.now()));
  }
}
