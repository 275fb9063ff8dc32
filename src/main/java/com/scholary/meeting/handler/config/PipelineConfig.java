package com.scholary.meeting.handler.config;

import com.scholary.meeting.handler.cache.ChunkResultCache;
import com.scholary.meeting.handler.cache.InMemoryChunkResultCache;
import com.scholary.meeting.handler.chunking.ChunkingParameters;
import com.scholary.meeting.handler.chunking.TextChunker;
import com.scholary.meeting.handler.segment.TurnSegmenter;
import com.scholary.meeting.handler.token.TokenEstimator;
import com.scholary.meeting.handler.token.TokenEstimators;
import com.scholary.meeting.handler.transcript.MergeParameters;
import com.scholary.meeting.handler.transcript.OverlapTurnMerger;
import com.scholary.meeting.handler.transcript.PassThroughMerger;
import com.scholary.meeting.handler.transcript.TurnsValidator;
import jakarta.validation.Validator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the chunk, merge and segment components from {@link PipelineProperties}.
 *
 * <p>The components themselves are plain classes; only this class knows about Spring.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

  @Bean
  public TokenEstimator tokenEstimator(PipelineProperties properties) {
    return TokenEstimators.select(
        properties.tokens().mode(), properties.tokens().fallbackCharsPerToken());
  }

  @Bean
  public ChunkingParameters chunkingParameters(PipelineProperties properties) {
    PipelineProperties.ChunkingProperties chunking = properties.chunking();
    return new ChunkingParameters(
        chunking.chunkSizeTokens(),
        chunking.overlapTokens(),
        chunking.charsPerToken(),
        chunking.searchRadiusChars());
  }

  @Bean
  public TextChunker textChunker(ChunkingParameters chunkingParameters) {
    return new TextChunker(chunkingParameters);
  }

  @Bean
  public OverlapTurnMerger overlapTurnMerger(PipelineProperties properties) {
    PipelineProperties.MergeProperties merge = properties.merge();
    return new OverlapTurnMerger(
        new MergeParameters(
            merge.similarityThreshold(), merge.averageTurnChars(), merge.maxLookbackTurns()));
  }

  @Bean
  public PassThroughMerger passThroughMerger() {
    return new PassThroughMerger();
  }

  @Bean
  public TurnSegmenter turnSegmenter(PipelineProperties properties, TokenEstimator tokenEstimator) {
    return new TurnSegmenter(tokenEstimator, properties.segmentation().maxTokensPerSegment());
  }

  @Bean
  public TurnsValidator turnsValidator(Validator validator) {
    return new TurnsValidator(validator);
  }

  @Bean
  public ChunkResultCache chunkResultCache(PipelineProperties properties) {
    return new InMemoryChunkResultCache(
        properties.cache().maxSize(), properties.cache().ttl());
  }
}
