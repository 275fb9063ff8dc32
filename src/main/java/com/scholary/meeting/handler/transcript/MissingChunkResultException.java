package com.scholary.meeting.handler.transcript;

/**
 * Thrown when a chunk listed in the chunk metadata has no analysis result.
 *
 * <p>Merging without it would silently drop that part of the transcript, so the merge aborts.
 */
public class MissingChunkResultException extends RuntimeException {

  private final int chunkIndex;

  public MissingChunkResultException(int chunkIndex, String message) {
    super(message);
    this.chunkIndex = chunkIndex;
  }

  public MissingChunkResultException(int chunkIndex, String message, Throwable cause) {
    super(message, cause);
    this.chunkIndex = chunkIndex;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }
}
