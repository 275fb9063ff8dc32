package com.scholary.meeting.handler.token;

/**
 * Estimates how many model tokens a piece of text will consume.
 *
 * <p>Implementations are chosen once at startup (see {@code PipelineConfig}): a precise one
 * backed by a real tokenizer when it can be loaded, otherwise a character-ratio heuristic.
 */
public interface TokenEstimator {

  /**
   * Estimate the token count of the given text.
   *
   * @param text the text, may be null
   * @return estimated tokens, 0 for null or empty text
   */
  int estimate(String text);

  /** Name used in logs and the chunk metadata record. */
  String name();
}
