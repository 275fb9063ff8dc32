package com.scholary.meeting.handler.transcript;

/**
 * Tuning for the overlap merge.
 *
 * <p>The lookback window is a heuristic: the overlap holds roughly
 * {@code overlapChars / averageTurnChars} turns, so only that many trailing turns can have been
 * repeated by the next chunk.
 *
 * @param similarityThreshold minimum word similarity for two same-speaker turns to be duplicates
 * @param averageTurnChars assumed average length of one turn
 * @param maxLookbackTurns upper bound on the lookback window
 */
public record MergeParameters(
    double similarityThreshold, int averageTurnChars, int maxLookbackTurns) {

  public static final int DEFAULT_AVERAGE_TURN_CHARS = 200;
  public static final int DEFAULT_MAX_LOOKBACK_TURNS = 50;

  public MergeParameters {
    if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
      throw new IllegalArgumentException("Similarity threshold must be in [0, 1]");
    }
    if (averageTurnChars <= 0) {
      throw new IllegalArgumentException("Average turn length must be positive");
    }
    if (maxLookbackTurns <= 0) {
      throw new IllegalArgumentException("Max lookback must be positive");
    }
  }

  public static MergeParameters defaults() {
    return new MergeParameters(
        DuplicateTurnFinder.MERGE_THRESHOLD, DEFAULT_AVERAGE_TURN_CHARS, DEFAULT_MAX_LOOKBACK_TURNS);
  }

  /**
   * Number of already-merged trailing turns a new chunk is compared against.
   *
   * @param overlapChars overlap window in characters
   * @return window size, at least 1 and at most {@code maxLookbackTurns}
   */
  public int lookbackTurns(int overlapChars) {
    int estimate = overlapChars / averageTurnChars;
    return Math.max(1, Math.min(maxLookbackTurns, estimate));
  }
}
