package com.scholary.meeting.handler.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.handler.transcript.Turn;
import java.util.List;

/**
 * A turns JSON document: either one chunk's analysis output or the merged transcript.
 *
 * <p>{@code metadata} is only present on the merged document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnsDocument(
    @JsonProperty("turns") List<Turn> turns, @JsonProperty("metadata") MergeInfo metadata) {

  public TurnsDocument {
    turns = turns == null ? List.of() : turns;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record MergeInfo(
      @JsonProperty("meeting_id") String meetingId,
      @JsonProperty("total_turns") int totalTurns,
      @JsonProperty("chunk_count") int chunkCount,
      @JsonProperty("merge_strategy") String mergeStrategy,
      @JsonProperty("validation_errors") List<String> validationErrors,
      @JsonProperty("merged_at") String mergedAt) {}
}
