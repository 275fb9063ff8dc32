package com.scholary.meeting.handler.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.meeting.handler.cache.ChunkResultCache;
import com.scholary.meeting.handler.chunking.ChunkingParameters;
import com.scholary.meeting.handler.segment.TurnSegmenter;
import com.scholary.meeting.handler.token.TokenEstimator;
import com.scholary.meeting.handler.token.TokenEstimatorMode;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.NONE,
    properties = "pipeline.tokens.mode=heuristic")
class PipelineConfigTest {

  @Autowired private PipelineProperties properties;
  @Autowired private ChunkingParameters chunkingParameters;
  @Autowired private TokenEstimator tokenEstimator;
  @Autowired private TurnSegmenter turnSegmenter;
  @Autowired private ChunkResultCache chunkResultCache;

  @Test
  void properties_shouldBindDefaultsFromApplicationYml() {
    assertThat(properties.chunking().chunkingThresholdTokens()).isEqualTo(50_000);
    assertThat(properties.merge().similarityThreshold()).isEqualTo(0.75);
    assertThat(properties.tokens().mode()).isEqualTo(TokenEstimatorMode.HEURISTIC);
    assertThat(properties.cache().ttl()).isEqualTo(Duration.ofHours(24));
  }

  @Test
  void beans_shouldBeBuiltFromProperties() {
    assertThat(chunkingParameters).isEqualTo(ChunkingParameters.defaults());
    assertThat(tokenEstimator.name()).isEqualTo("heuristic-4cpt");
    assertThat(turnSegmenter.maxTokensPerSegment()).isEqualTo(3000);
    assertThat(chunkResultCache.get("m1", 0)).isEmpty();
  }
}
