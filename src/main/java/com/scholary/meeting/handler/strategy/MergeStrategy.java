package com.scholary.meeting.handler.strategy;

import com.scholary.meeting.handler.transcript.ChunkTurns;
import com.scholary.meeting.handler.transcript.Turn;
import java.util.List;

/**
 * Strategy interface for merging per-chunk turn lists.
 *
 * <p>Different strategies are used based on how the transcript was processed:
 *
 * <ul>
 *   <li>Overlap: chunked transcript, duplicates at the seams are reconciled
 *   <li>Pass-through: unchunked transcript, the single result is used as is
 * </ul>
 */
public interface MergeStrategy {

  /**
   * Merge chunk results into a single ordered turn list.
   *
   * @param chunkResults the per-chunk results, in any order
   * @param plan how the transcript was chunked
   * @return merged turns
   * @throws com.scholary.meeting.handler.transcript.MissingChunkResultException if a planned
   *     chunk has no result
   */
  List<Turn> merge(List<ChunkTurns> chunkResults, MergePlan plan);

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();
}
