package com.scholary.meeting.handler.transcript;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a turn repeats one already emitted.
 *
 * <p>Two turns are duplicates when the speakers match (case and padding ignored) and their word
 * similarity reaches the threshold. Missing speaker or text compare as empty strings.
 */
public class DuplicateTurnFinder {

  private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateTurnFinder.class);

  /** Threshold used when reconciling chunk seams. */
  public static final double MERGE_THRESHOLD = 0.75;

  private final double threshold;

  public DuplicateTurnFinder(double threshold) {
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("Similarity threshold must be in [0, 1], got " + threshold);
    }
    this.threshold = threshold;
  }

  /**
   * Check one pair of turns.
   *
   * @param candidate the incoming turn
   * @param existing a previously emitted turn
   * @return true if candidate repeats existing
   */
  public boolean isDuplicate(Turn candidate, Turn existing) {
    if (!TextSimilarity.normalizeSpeaker(candidate.speaker())
        .equals(TextSimilarity.normalizeSpeaker(existing.speaker()))) {
      return false;
    }
    double similarity = TextSimilarity.similarity(candidate.text(), existing.text());
    if (similarity >= threshold) {
      LOGGER.debug("Found duplicate: speaker={}, similarity={}", existing.speaker(), similarity);
      return true;
    }
    return false;
  }

  /**
   * Find the first duplicate of {@code candidate} in {@code turns[from, to)}.
   *
   * @return the index into {@code turns}, or -1 if none
   */
  public int indexOfDuplicate(Turn candidate, List<Turn> turns, int from, int to) {
    int start = Math.max(0, from);
    int end = Math.min(turns.size(), to);
    for (int i = start; i < end; i++) {
      if (isDuplicate(candidate, turns.get(i))) {
        return i;
      }
    }
    return -1;
  }

  public double threshold() {
    return threshold;
  }
}
