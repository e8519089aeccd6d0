package com.scholary.video.summarizer.gemini;

/** Blocks the calling thread; swapped out in tests so polling runs without real waits. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
