package com.scholary.pipeline.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the PipelineProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {}
