package com.scholary.video.summarizer.chunking;

/**
 * One section of a split transcript.
 *
 * @param index zero-based position in the chunk sequence
 * @param text the chunk's words joined by single spaces
 * @param overlapWordCount leading words repeated from the tail of the previous chunk
 */
public record TranscriptChunk(int index, String text, int overlapWordCount) {}
