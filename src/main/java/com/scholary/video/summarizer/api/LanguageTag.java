package com.scholary.video.summarizer.api;

/** Accepted shape of the optional {@code language} field; empty falls back to the default. */
final class LanguageTag {

  static final String PATTERN = "|[A-Za-z]{2,3}(-[A-Za-z0-9]+)*";

  static final String MESSAGE = "must be a language code such as en or en-US";

  private LanguageTag() {}
}
