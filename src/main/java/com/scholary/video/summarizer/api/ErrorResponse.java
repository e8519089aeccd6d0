package com.scholary.video.summarizer.api;

/** Body of a rejected request. */
public record ErrorResponse(String error) {}
