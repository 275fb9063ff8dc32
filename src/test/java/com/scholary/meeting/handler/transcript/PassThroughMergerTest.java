package com.scholary.meeting.handler.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.meeting.handler.strategy.MergePlan;
import java.util.List;
import org.junit.jupiter.api.Test;

class PassThroughMergerTest {

  private final PassThroughMerger merger = new PassThroughMerger();

  @Test
  void merge_shouldReturnTheSingleResult() {
    List<Turn> turns = List.of(Turn.of("Alice", "hi"), Turn.of("Bob", "hello"));

    assertThat(merger.merge(List.of(new ChunkTurns(0, turns)), MergePlan.unchunked()))
        .isEqualTo(turns);
  }

  @Test
  void merge_shouldFailWithoutResults() {
    assertThatThrownBy(() -> merger.merge(List.of(), MergePlan.unchunked()))
        .isInstanceOf(MissingChunkResultException.class);
  }

  @Test
  void merge_shouldRejectMultipleResults() {
    List<ChunkTurns> results = List.of(new ChunkTurns(0, List.of()), new ChunkTurns(1, List.of()));

    assertThatThrownBy(() -> merger.merge(results, MergePlan.unchunked()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
