package com.scholary.pipeline.step;

import com.scholary.pipeline.result.ResultLog;

/** One named unit of work in a job. */
public interface StepExecutor {

  /** The step name used in operation lists and result logs. */
  String name();

  /**
   * Run the step against the job's result log, unless it already completed.
   *
   * @return the updated result log
   * @throws InputException if the step has no usable input
   * @throws StepExecutionException if the step fails otherwise
   */
  ResultLog execute(StepContext context);
}
