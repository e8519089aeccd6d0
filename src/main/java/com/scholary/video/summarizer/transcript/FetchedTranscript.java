package com.scholary.video.summarizer.transcript;

/** A transcript plus the caption language that produced it and a title guessed from its text. */
public record FetchedTranscript(String text, String languageCode, String title) {}
