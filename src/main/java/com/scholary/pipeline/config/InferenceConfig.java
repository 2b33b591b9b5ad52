package com.scholary.pipeline.config;

import com.scholary.pipeline.inference.InferenceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration for the summarizer and translator clients. */
@Configuration
@EnableConfigurationProperties(InferenceProperties.class)
public class InferenceConfig {}
