package com.scholary.pipeline.step;

import static com.scholary.pipeline.step.StepFixtures.runningJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.scholary.pipeline.job.Job;
import com.scholary.pipeline.job.JobStore;
import com.scholary.pipeline.job.JobType;
import com.scholary.pipeline.job.SummarizeParams;
import com.scholary.pipeline.result.StepNames;
import com.scholary.pipeline.result.StepRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InputTextStepTest {

  @Mock private JobStore jobStore;

  @Test
  void testSeed_StoresTextVerbatimAsCompletedStep() {
    Job job = runningJob(JobType.SUMMARIZE, new SummarizeParams(null, false), null);
    InputTextStep step = new InputTextStep(jobStore);

    step.seed(new StepContext(job, null), "  raw text\n");
    step.seed(new StepContext(job, null), "other text");

    StepRecord record = job.getResult().findCompleted(StepNames.INPUT_TEXT).orElseThrow();
    assertThat(record.outputText("text")).contains("  raw text\n");
    assertThat(job.getResult().getSteps()).hasSize(1);
    verify(jobStore, times(1)).save(job);
  }
}
