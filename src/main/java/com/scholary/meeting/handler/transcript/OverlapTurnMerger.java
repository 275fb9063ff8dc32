package com.scholary.meeting.handler.transcript;

import com.scholary.meeting.handler.logging.StructuredLogger;
import com.scholary.meeting.handler.strategy.MergePlan;
import com.scholary.meeting.handler.strategy.MergeStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges per-chunk turn lists from an overlapping chunking run.
 *
 * <p>Strategy:
 *
 * <ol>
 *   <li>Keep every turn of chunk 0.
 *   <li>For each following chunk, in index order, compare each turn against the tail of what has
 *       been merged so far. The tail is fixed before the chunk starts, so turns of the same chunk
 *       never absorb each other.
 *   <li>A same-speaker turn with similar enough text replaces its earlier copy in place with the
 *       more complete version. Later duplicates are only searched for after the last match, which
 *       keeps the merged order monotonic. The trade-off: a spurious early match hides any real
 *       duplicate that sits before it in the window, and that turn is appended a second time.
 *   <li>Everything else is appended.
 * </ol>
 *
 * <p>Chunks must be merged strictly in order: the duplicate test is only meaningful against the
 * just-finished tail of the previous chunk.
 */
public class OverlapTurnMerger implements MergeStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlapTurnMerger.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final MergeParameters parameters;
  private final DuplicateTurnFinder duplicateFinder;

  public OverlapTurnMerger(MergeParameters parameters) {
    this.parameters = parameters;
    this.duplicateFinder = new DuplicateTurnFinder(parameters.similarityThreshold());
  }

  @Override
  public List<Turn> merge(List<ChunkTurns> chunkResults, MergePlan plan) {
    if (plan.chunkCount() == 0) {
      return List.of();
    }

    Map<Integer, List<Turn>> byIndex = indexResults(chunkResults, plan.chunkCount());

    if (plan.chunkCount() == 1) {
      LOGGER.info("Single chunk, passing {} turns through", byIndex.get(0).size());
      return byIndex.get(0);
    }

    int lookback = parameters.lookbackTurns(plan.overlapChars());
    LOGGER.info(
        "Merging {} chunks: overlap={} chars, lookback={} turns, threshold={}",
        plan.chunkCount(),
        plan.overlapChars(),
        lookback,
        duplicateFinder.threshold());

    List<Turn> merged = new ArrayList<>(byIndex.get(0));
    LOGGER.info("Chunk 0: added {} turns", merged.size());

    for (int chunkIndex = 1; chunkIndex < plan.chunkCount(); chunkIndex++) {
      List<Turn> chunkTurns = byIndex.get(chunkIndex);

      int windowEnd = merged.size();
      int searchFrom = Math.max(0, windowEnd - lookback);
      int duplicates = 0;
      int added = 0;

      for (Turn turn : chunkTurns) {
        int match = duplicateFinder.indexOfDuplicate(turn, merged, searchFrom, windowEnd);
        if (match >= 0) {
          merged.set(match, resolve(merged.get(match), turn));
          searchFrom = match + 1;
          duplicates++;
        } else {
          merged.add(turn);
          added++;
        }
      }

      STRUCTURED.logOverlapMerge(chunkIndex - 1, chunkIndex, lookback, duplicates, added);
    }

    List<Turn> result = new ArrayList<>(merged.size());
    for (int i = 0; i < merged.size(); i++) {
      result.add(merged.get(i).withIdx(i));
    }

    LOGGER.info(
        "Final merge: {} total turns from {} chunks", result.size(), plan.chunkCount());
    return List.copyOf(result);
  }

  @Override
  public String getStrategyName() {
    return "OVERLAP";
  }

  /**
   * Combine two copies of the same utterance.
   *
   * <p>The longer normalized text wins (the other chunk probably cut it off). If both carry a
   * start timestamp the earlier one is kept.
   *
   * @param existing the already-merged turn
   * @param incoming the duplicate from the next chunk
   * @return the turn to store in place of {@code existing}
   */
  static Turn resolve(Turn existing, Turn incoming) {
    int existingLength = TextSimilarity.normalizeText(existing.text()).length();
    int incomingLength = TextSimilarity.normalizeText(incoming.text()).length();
    Turn base = incomingLength > existingLength ? incoming : existing;

    String existingTs = existing.startTs();
    String incomingTs = incoming.startTs();
    if (existingTs != null && !existingTs.isBlank() && incomingTs != null && !incomingTs.isBlank()) {
      String earlier = existingTs.compareTo(incomingTs) <= 0 ? existingTs : incomingTs;
      base = base.withStartTs(earlier);
    }
    return base.withIdx(existing.idx());
  }

  /**
   * Key results by chunk index and check that every planned chunk is present.
   *
   * <p>A repeated index (a retried analysis call reported twice) keeps the last result.
   */
  private Map<Integer, List<Turn>> indexResults(List<ChunkTurns> chunkResults, int chunkCount) {
    Map<Integer, List<Turn>> byIndex = new TreeMap<>();
    for (ChunkTurns result : chunkResults) {
      if (result.chunkIndex() < 0 || result.chunkIndex() >= chunkCount) {
        throw new IllegalArgumentException(
            String.format(
                "Result for chunk %d does not belong to a %d-chunk plan",
                result.chunkIndex(), chunkCount));
      }
      if (byIndex.put(result.chunkIndex(), result.turns()) != null) {
        LOGGER.warn("Chunk {} reported more than once, keeping the last result", result.chunkIndex());
      }
    }

    for (int i = 0; i < chunkCount; i++) {
      if (!byIndex.containsKey(i)) {
        throw new MissingChunkResultException(
            i, String.format("No result for chunk %d of %d", i, chunkCount));
      }
    }
    return byIndex;
  }
}
