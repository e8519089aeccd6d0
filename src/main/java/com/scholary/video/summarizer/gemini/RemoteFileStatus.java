package com.scholary.video.summarizer.gemini;

/** Result of a status lookup by durable name. */
public record RemoteFileStatus(String name, RemoteFileState state, String mimeType) {}
