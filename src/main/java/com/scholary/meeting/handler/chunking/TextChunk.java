package com.scholary.meeting.handler.chunking;

/**
 * One overlapping window of a transcript.
 *
 * <p>Offsets are half-open character offsets into the original text. {@code overlapText} is the
 * suffix of {@code text} starting at {@code overlapStartOffset}; it is empty for the last chunk.
 */
public record TextChunk(
    int index,
    String text,
    int startOffset,
    int endOffset,
    int overlapStartOffset,
    String overlapText,
    int estimatedTokens,
    boolean hasNext) {

  public int length() {
    return endOffset - startOffset;
  }
}
