package com.scholary.meeting.handler.token;

/**
 * Character-ratio token estimate.
 *
 * <p>Four characters per token is the usual fallback when no tokenizer is available. Three
 * characters per token overestimates on purpose and is good enough for a quick "does this need
 * chunking at all" check.
 */
public class HeuristicTokenEstimator implements TokenEstimator {

  public static final int DEFAULT_CHARS_PER_TOKEN = 4;
  public static final int QUICK_CHARS_PER_TOKEN = 3;

  private final int charsPerToken;

  public HeuristicTokenEstimator(int charsPerToken) {
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive, got " + charsPerToken);
    }
    this.charsPerToken = charsPerToken;
  }

  /** Rough estimator for fast pre-checks where exactness does not matter. */
  public static HeuristicTokenEstimator quick() {
    return new HeuristicTokenEstimator(QUICK_CHARS_PER_TOKEN);
  }

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return Math.max(1, text.length() / charsPerToken);
  }

  @Override
  public String name() {
    return "heuristic-" + charsPerToken + "cpt";
  }
}
