package com.scholary.video.summarizer.config;

import com.scholary.video.summarizer.gemini.GeminiProperties;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Gemini clients.
 *
 * <p>The uploader, the files client and the generative model share one HTTP client. Per-request
 * timeouts come from {@link GeminiProperties}; only the connect timeout is set here.
 */
@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class GeminiConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiConfig.class);

  @Bean
  public HttpClient geminiHttpClient(GeminiProperties properties) {
    LOGGER.info(
        "Initialized Gemini client: baseUrl={}, model={}, apiKeyConfigured={}",
        properties.baseUrl(),
        properties.model(),
        properties.hasApiKey());

    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
        .build();
  }
}
