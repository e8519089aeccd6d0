package com.scholary.video.summarizer.api;

/** Availability of backing services. {@code gemini} is true when an API key is configured. */
public record StatusResponse(boolean gemini) {}
