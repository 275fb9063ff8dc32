package com.scholary.meeting.handler.transcript;

import com.scholary.meeting.handler.strategy.MergePlan;
import com.scholary.meeting.handler.strategy.MergeStrategy;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merge for transcripts that were small enough to skip chunking.
 *
 * <p>There is exactly one result and nothing to reconcile.
 */
public class PassThroughMerger implements MergeStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(PassThroughMerger.class);

  @Override
  public List<Turn> merge(List<ChunkTurns> chunkResults, MergePlan plan) {
    if (chunkResults.isEmpty()) {
      throw new MissingChunkResultException(0, "No chunk results found");
    }
    if (chunkResults.size() > 1) {
      throw new IllegalArgumentException(
          "Unchunked transcript has " + chunkResults.size() + " results, expected 1");
    }
    List<Turn> turns = chunkResults.get(0).turns();
    LOGGER.info("Transcript was not chunked, passing {} turns through", turns.size());
    return turns;
  }

  @Override
  public String getStrategyName() {
    return "PASS_THROUGH";
  }
}
