package com.scholary.meeting.handler.api;

import java.util.List;

/**
 * Response for chunk preview request.
 *
 * <p>Shows how the text would be split without writing chunk files.
 */
public record ChunkPreviewResponse(int totalChars, int chunkCount, List<ChunkView> chunks) {

  public record ChunkView(
      int index, int start, int end, int overlapStart, int estimatedTokens, boolean hasNext) {}
}
