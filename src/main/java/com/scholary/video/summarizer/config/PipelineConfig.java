package com.scholary.video.summarizer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for pipeline-related beans.
 *
 * <p>Enables the PipelineProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {}
