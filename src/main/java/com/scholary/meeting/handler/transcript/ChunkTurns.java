package com.scholary.meeting.handler.transcript;

import java.util.List;
import java.util.Objects;

/**
 * The analysis step's turns for a single chunk.
 *
 * <p>Results may arrive in any order; the chunk index is what places them. Null entries (a
 * {@code null} in the JSON array) carry nothing and are dropped.
 */
public record ChunkTurns(int chunkIndex, List<Turn> turns) {

  public ChunkTurns {
    turns = turns == null ? List.of() : turns.stream().filter(Objects::nonNull).toList();
  }
}
