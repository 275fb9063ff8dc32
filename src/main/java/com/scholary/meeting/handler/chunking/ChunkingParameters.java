package com.scholary.meeting.handler.chunking;

/**
 * Budgets for splitting a transcript.
 *
 * <p>Token budgets are converted to character budgets with a fixed characters-per-token ratio.
 */
public record ChunkingParameters(
    int chunkSizeTokens, int overlapTokens, int charsPerToken, int searchRadiusChars) {

  public static final int DEFAULT_CHUNK_SIZE_TOKENS = 15_000;
  public static final int DEFAULT_OVERLAP_TOKENS = 2_000;
  public static final int DEFAULT_CHARS_PER_TOKEN = 3;
  public static final int DEFAULT_SEARCH_RADIUS_CHARS = 500;

  public ChunkingParameters {
    if (chunkSizeTokens <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive");
    }
    if (overlapTokens < 0) {
      throw new IllegalArgumentException("Overlap cannot be negative");
    }
    if (overlapTokens >= chunkSizeTokens) {
      throw new IllegalArgumentException(
          String.format(
              "Overlap (%d tokens) must be less than chunk size (%d tokens)",
              overlapTokens, chunkSizeTokens));
    }
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("Characters per token must be positive");
    }
    if (searchRadiusChars < 0) {
      throw new IllegalArgumentException("Search radius cannot be negative");
    }
  }

  public static ChunkingParameters defaults() {
    return new ChunkingParameters(
        DEFAULT_CHUNK_SIZE_TOKENS,
        DEFAULT_OVERLAP_TOKENS,
        DEFAULT_CHARS_PER_TOKEN,
        DEFAULT_SEARCH_RADIUS_CHARS);
  }

  public int chunkSizeChars() {
    return chunkSizeTokens * charsPerToken;
  }

  public int overlapChars() {
    return overlapTokens * charsPerToken;
  }

  /** How far the start of each chunk moves past the start of the previous one. */
  public int strideChars() {
    return chunkSizeChars() - overlapChars();
  }
}
