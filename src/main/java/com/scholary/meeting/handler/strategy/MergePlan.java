package com.scholary.meeting.handler.strategy;

import com.scholary.meeting.handler.metadata.ChunkMetadata;

/**
 * What a merge needs to know about how the transcript was chunked.
 *
 * @param chunkCount number of chunks the transcript was split into
 * @param overlapChars size of the overlap window between consecutive chunks, in characters
 */
public record MergePlan(int chunkCount, int overlapChars) {

  public MergePlan {
    if (chunkCount < 0) {
      throw new IllegalArgumentException("Chunk count cannot be negative");
    }
    if (overlapChars < 0) {
      throw new IllegalArgumentException("Overlap cannot be negative");
    }
  }

  /** Plan for a transcript that was never chunked. */
  public static MergePlan unchunked() {
    return new MergePlan(1, 0);
  }

  /** Plan derived from a chunking run's audit record. */
  public static MergePlan from(ChunkMetadata metadata) {
    return new MergePlan(metadata.chunkCount(), metadata.chunkingParams().overlapChars());
  }
}
