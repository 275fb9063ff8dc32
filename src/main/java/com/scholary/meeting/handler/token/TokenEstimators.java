package com.scholary.meeting.handler.token;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Picks the token estimator once, at startup. */
public final class TokenEstimators {

  private static final Logger LOGGER = LoggerFactory.getLogger(TokenEstimators.class);

  private TokenEstimators() {}

  /**
   * Select an estimator for the given mode.
   *
   * @param mode selection mode
   * @param fallbackCharsPerToken ratio for the heuristic
   * @return the estimator to use for the lifetime of the application
   */
  public static TokenEstimator select(TokenEstimatorMode mode, int fallbackCharsPerToken) {
    return select(mode, fallbackCharsPerToken, JTokkitTokenEstimator::new);
  }

  static TokenEstimator select(
      TokenEstimatorMode mode, int fallbackCharsPerToken, Supplier<TokenEstimator> precise) {
    TokenEstimator estimator;
    if (mode == TokenEstimatorMode.HEURISTIC) {
      estimator = new HeuristicTokenEstimator(fallbackCharsPerToken);
    } else if (mode == TokenEstimatorMode.JTOKKIT) {
      estimator = precise.get();
    } else {
      try {
        estimator = precise.get();
      } catch (RuntimeException | LinkageError e) {
        LOGGER.warn("Tokenizer unavailable, falling back to character heuristic: {}", e.toString());
        estimator = new HeuristicTokenEstimator(fallbackCharsPerToken);
      }
    }
    LOGGER.info("Token estimator selected: mode={}, estimator={}", mode, estimator.name());
    return estimator;
  }
}
