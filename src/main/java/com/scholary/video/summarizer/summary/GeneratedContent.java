package com.scholary.video.summarizer.summary;

/** Transcript and summary produced from a staged video file. */
public record GeneratedContent(String transcript, String summary) {}
