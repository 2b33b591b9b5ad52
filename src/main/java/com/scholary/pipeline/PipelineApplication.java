package com.scholary.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Document processing service: transcription, summarization and translation jobs. */
@SpringBootApplication
public class PipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(PipelineApplication.class, args);
  }
}
