package com.scholary.video.summarizer.config;

import com.scholary.video.summarizer.transcript.TranscriptProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the TranscriptProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(TranscriptProperties.class)
public class TranscriptConfig {}
