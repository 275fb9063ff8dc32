package com.scholary.meeting.handler.segment;

import com.scholary.meeting.handler.logging.StructuredLogger;
import com.scholary.meeting.handler.token.TokenEstimator;
import com.scholary.meeting.handler.transcript.Turn;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups consecutive turns into segments under a token ceiling.
 *
 * <p>Cuts only between turns. A turn that alone exceeds the ceiling still gets a segment of its
 * own; the ceiling decides where to cut, it never rejects input.
 */
public class TurnSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TurnSegmenter.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  public static final int DEFAULT_MAX_TOKENS_PER_SEGMENT = 3000;
  static final String UNKNOWN_SPEAKER = "Unknown";

  private final TokenEstimator tokenEstimator;
  private final int maxTokensPerSegment;

  public TurnSegmenter(TokenEstimator tokenEstimator, int maxTokensPerSegment) {
    if (maxTokensPerSegment <= 0) {
      throw new IllegalArgumentException("Segment token ceiling must be positive");
    }
    this.tokenEstimator = tokenEstimator;
    this.maxTokensPerSegment = maxTokensPerSegment;
  }

  /**
   * Build segments from turns in order.
   *
   * @param turns the merged turns
   * @return segments with ids 1..N; empty if there are no turns
   */
  public List<Segment> segment(List<Turn> turns) {
    if (turns == null || turns.isEmpty()) {
      return List.of();
    }

    List<Segment> segments = new ArrayList<>();
    List<Turn> current = new ArrayList<>();
    int currentTokens = 0;

    for (Turn turn : turns) {
      int turnTokens = tokenEstimator.estimate(turn.text());

      if (!current.isEmpty() && currentTokens + turnTokens > maxTokensPerSegment) {
        segments.add(build(segments.size() + 1, current, currentTokens));
        current = new ArrayList<>();
        currentTokens = 0;
      }

      current.add(turn);
      currentTokens += turnTokens;
    }

    if (!current.isEmpty()) {
      segments.add(build(segments.size() + 1, current, currentTokens));
    }

    LOGGER.info(
        "Segmented {} turns into {} segments (ceiling {} tokens, estimator {})",
        turns.size(),
        segments.size(),
        maxTokensPerSegment,
        tokenEstimator.name());
    return segments;
  }

  private Segment build(int id, List<Turn> turns, int estimatedTokens) {
    Turn first = turns.get(0);
    Turn last = turns.get(turns.size() - 1);

    Set<String> speakers = new LinkedHashSet<>();
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < turns.size(); i++) {
      Turn turn = turns.get(i);
      speakers.add(turn.speaker() != null ? turn.speaker() : UNKNOWN_SPEAKER);
      if (i > 0) {
        text.append('\n');
      }
      text.append(turn.text() != null ? turn.text() : "");
    }

    STRUCTURED.logSegmentBuilt(id, turns.size(), estimatedTokens, maxTokensPerSegment);

    return new Segment(
        id,
        TimestampParser.toSeconds(first.startTs()),
        TimestampParser.toSeconds(last.endTs()),
        "Segment " + id,
        new ArrayList<>(speakers),
        text.toString(),
        turns);
  }

  public int maxTokensPerSegment() {
    return maxTokensPerSegment;
  }
}
