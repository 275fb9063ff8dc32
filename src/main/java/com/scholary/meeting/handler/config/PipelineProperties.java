package com.scholary.meeting.handler.config;

import com.scholary.meeting.handler.token.TokenEstimatorMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the chunk, merge and segment steps.
 *
 * <p>Bound from the "pipeline.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotNull @Valid ChunkingProperties chunking,
    @NotNull @Valid MergeProperties merge,
    @NotNull @Valid SegmentationProperties segmentation,
    @NotNull @Valid TokenProperties tokens,
    @NotNull @Valid CacheProperties cache) {

  /**
   * @param chunkingThresholdTokens transcripts estimated at or under this are not chunked
   */
  public record ChunkingProperties(
      @Positive int chunkSizeTokens,
      @PositiveOrZero int overlapTokens,
      @Positive int charsPerToken,
      @PositiveOrZero int searchRadiusChars,
      @Positive int chunkingThresholdTokens) {}

  public record MergeProperties(
      @DecimalMin("0.0") @DecimalMax("1.0") double similarityThreshold,
      @Positive int averageTurnChars,
      @Positive int maxLookbackTurns) {}

  public record SegmentationProperties(@Positive int maxTokensPerSegment) {}

  public record TokenProperties(@NotNull TokenEstimatorMode mode, @Positive int fallbackCharsPerToken) {}

  public record CacheProperties(@Positive long maxSize, @NotNull Duration ttl) {}
}
