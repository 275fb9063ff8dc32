package com.scholary.meeting.handler.token;

/** How the token estimator is picked at startup. */
public enum TokenEstimatorMode {
  /** Use the tokenizer if it loads, otherwise the heuristic. */
  AUTO,
  /** Require the tokenizer; startup fails without it. */
  JTOKKIT,
  /** Always use the character-ratio heuristic. */
  HEURISTIC
}
