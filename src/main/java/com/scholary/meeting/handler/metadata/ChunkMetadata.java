package com.scholary.meeting.handler.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.handler.chunking.ChunkingParameters;
import com.scholary.meeting.handler.chunking.TextChunk;
import java.util.List;

/**
 * Audit record of one chunking run, written next to the chunk files.
 *
 * <p>The merge step reads it back to learn how many chunk results to expect and how wide the
 * overlap was.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkMetadata(
    @JsonProperty("meeting_id") String meetingId,
    @JsonProperty("original_input_key") String originalInputKey,
    @JsonProperty("chunk_count") int chunkCount,
    @JsonProperty("total_chars") int totalChars,
    @JsonProperty("estimated_total_tokens") int estimatedTotalTokens,
    @JsonProperty("token_estimator") String tokenEstimator,
    @JsonProperty("chunking_params") ChunkingParams chunkingParams,
    @JsonProperty("chunks") List<ChunkEntry> chunks,
    @JsonProperty("created_at") String createdAt) {

  public ChunkMetadata {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
    if (chunkingParams == null) {
      chunkingParams = ChunkingParams.from(ChunkingParameters.defaults());
    }
  }

  /**
   * Chunking parameters as recorded.
   *
   * <p>Records written before {@code chars_per_token} existed used a ratio of 3.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ChunkingParams(
      @JsonProperty("chunk_size_tokens") int chunkSizeTokens,
      @JsonProperty("overlap_tokens") int overlapTokens,
      @JsonProperty("chars_per_token") int charsPerToken,
      @JsonProperty("search_radius_chars") int searchRadiusChars) {

    public ChunkingParams {
      if (charsPerToken <= 0) {
        charsPerToken = ChunkingParameters.DEFAULT_CHARS_PER_TOKEN;
      }
    }

    public static ChunkingParams from(ChunkingParameters parameters) {
      return new ChunkingParams(
          parameters.chunkSizeTokens(),
          parameters.overlapTokens(),
          parameters.charsPerToken(),
          parameters.searchRadiusChars());
    }

    public int overlapChars() {
      return overlapTokens * charsPerToken;
    }
  }

  /** Location and offsets of one chunk. {@code overlapKey} is null when there is no overlap. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ChunkEntry(
      @JsonProperty("chunk_index") int chunkIndex,
      @JsonProperty("input_key") String inputKey,
      @JsonProperty("overlap_key") String overlapKey,
      @JsonProperty("output_key") String outputKey,
      @JsonProperty("start_char") int startChar,
      @JsonProperty("end_char") int endChar,
      @JsonProperty("overlap_start_char") int overlapStartChar,
      @JsonProperty("estimated_tokens") int estimatedTokens,
      @JsonProperty("has_next_chunk") boolean hasNextChunk) {

    public static ChunkEntry of(
        TextChunk chunk, String inputKey, String overlapKey, String outputKey) {
      return new ChunkEntry(
          chunk.index(),
          inputKey,
          overlapKey,
          outputKey,
          chunk.startOffset(),
          chunk.endOffset(),
          chunk.overlapStartOffset(),
          chunk.estimatedTokens(),
          chunk.hasNext());
    }
  }
}
