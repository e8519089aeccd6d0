package com.scholary.video.summarizer.pipeline;

/** Transcript and summary produced by one run, before persistence. */
public record ProcessingResult(String title, String transcript, String summary, long durationSeconds) {}
