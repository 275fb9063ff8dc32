package com.scholary.meeting.handler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.handler.api.ChunkPreviewResponse;
import com.scholary.meeting.handler.api.ChunkResponse;
import com.scholary.meeting.handler.chunking.ChunkingParameters;
import com.scholary.meeting.handler.chunking.TextChunker;
import com.scholary.meeting.handler.config.PipelineProperties;
import com.scholary.meeting.handler.config.PipelineProperties.CacheProperties;
import com.scholary.meeting.handler.config.PipelineProperties.ChunkingProperties;
import com.scholary.meeting.handler.config.PipelineProperties.MergeProperties;
import com.scholary.meeting.handler.config.PipelineProperties.SegmentationProperties;
import com.scholary.meeting.handler.config.PipelineProperties.TokenProperties;
import com.scholary.meeting.handler.metadata.ChunkMetadata;
import com.scholary.meeting.handler.objectstore.ObjectNotFoundException;
import com.scholary.meeting.handler.objectstore.ObjectStoreClient;
import com.scholary.meeting.handler.objectstore.ObjectStoreProperties;
import com.scholary.meeting.handler.token.HeuristicTokenEstimator;
import com.scholary.meeting.handler.token.TokenEstimator;
import com.scholary.meeting.handler.token.TokenEstimatorMode;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptChunkingServiceTest {

  private static final String BUCKET = "test-bucket";

  @Mock private ObjectStoreClient objectStoreClient;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private InMemoryObjectStore store;
  private TranscriptChunkingService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryObjectStore(objectStoreClient);
    service = serviceWith(new HeuristicTokenEstimator(4));
  }

  private TranscriptChunkingService serviceWith(TokenEstimator tokenEstimator) {
    // 10 chars per chunk, 2 chars overlap; anything over 5 tokens is chunked
    PipelineProperties pipeline =
        new PipelineProperties(
            new ChunkingProperties(10, 2, 1, 3, 5),
            new MergeProperties(0.75, 200, 50),
            new SegmentationProperties(3000),
            new TokenProperties(TokenEstimatorMode.HEURISTIC, 4),
            new CacheProperties(100, Duration.ofMinutes(5)));
    ObjectStoreProperties objectStore =
        new ObjectStoreProperties(
            "http://localhost:9000", "admin", "admin123", BUCKET, "us-east-1", true);

    return new TranscriptChunkingService(
        new ArtifactStore(objectMapper, objectStoreClient),
        new TextChunker(new ChunkingParameters(10, 2, 1, 3)),
        tokenEstimator,
        objectStore,
        pipeline);
  }

  @Test
  void chunk_shouldLeaveShortTranscriptUnchunked() throws Exception {
    store.put("raw/m1.txt", "hello");

    ChunkResponse response = service.chunk("m1", "raw/m1.txt", null);

    assertThat(response.chunked()).isFalse();
    assertThat(response.chunkCount()).isEqualTo(1);
    assertThat(response.metadataKey()).isNull();
    assertThat(response.chunks().get(0).inputKey()).isEqualTo("raw/m1.txt");
    assertThat(response.chunks().get(0).outputKey()).isEqualTo("meetings/m1/chunk_0_turns.json");
    assertThat(store.objects()).containsOnlyKeys("raw/m1.txt");
  }

  @Test
  void chunk_shouldSkipConfiguredEstimatorWhenQuickEstimateIsUnderThreshold() throws Exception {
    TokenEstimator configured = mock(TokenEstimator.class);
    store.put("raw/m1.txt", "hello there");

    ChunkResponse response = serviceWith(configured).chunk("m1", "raw/m1.txt", null);

    assertThat(response.chunked()).isFalse();
    assertThat(response.estimatedTokens()).isEqualTo(3);
    verify(configured, never()).estimate(anyString());
  }

  @Test
  void chunk_shouldLetConfiguredEstimatorDecideWhenQuickEstimateIsOver() throws Exception {
    // 18 chars: 6 tokens at three chars per token, 4 at four
    store.put("raw/m1.txt", "abcdefghijklmnopqr");

    ChunkResponse response = service.chunk("m1", "raw/m1.txt", null);

    assertThat(response.chunked()).isFalse();
    assertThat(response.estimatedTokens()).isEqualTo(4);
    assertThat(store.objects()).containsOnlyKeys("raw/m1.txt");
  }

  @Test
  void chunk_shouldWriteChunksOverlapsAndMetadata() throws Exception {
    store.put("raw/m1.txt", "abcdefghijklmnopqrstuvwxyz");

    ChunkResponse response = service.chunk("m1", "raw/m1.txt", null);

    assertThat(response.chunked()).isTrue();
    assertThat(response.chunkCount()).isEqualTo(3);
    assertThat(response.metadataKey()).isEqualTo("meetings/m1/chunks/metadata.json");
    assertThat(store.get("meetings/m1/chunks/chunk_0.txt")).isEqualTo("abcdefghij");
    assertThat(store.get("meetings/m1/chunks/chunk_0_overlap.txt")).isEqualTo("ij");
    assertThat(store.get("meetings/m1/chunks/chunk_1.txt")).isEqualTo("ijklmnopqr");
    assertThat(store.get("meetings/m1/chunks/chunk_2.txt")).isEqualTo("qrstuvwxyz");
    assertThat(store.objects()).doesNotContainKey("meetings/m1/chunks/chunk_2_overlap.txt");

    ChunkMetadata metadata =
        objectMapper.readValue(
            store.get("meetings/m1/chunks/metadata.json"), ChunkMetadata.class);
    assertThat(metadata.meetingId()).isEqualTo("m1");
    assertThat(metadata.chunkCount()).isEqualTo(3);
    assertThat(metadata.totalChars()).isEqualTo(26);
    assertThat(metadata.tokenEstimator()).isEqualTo("heuristic-4cpt");
    assertThat(metadata.chunkingParams().overlapChars()).isEqualTo(2);
    assertThat(metadata.chunks().get(1).overlapKey())
        .isEqualTo("meetings/m1/chunks/chunk_1_overlap.txt");
    assertThat(metadata.chunks().get(2).overlapKey()).isNull();
    assertThat(metadata.chunks().get(2).hasNextChunk()).isFalse();
  }

  @Test
  void chunk_shouldUseRequestedPrefix() throws Exception {
    store.put("raw/m1.txt", "abcdefghijklmnopqrstuvwxyz");

    ChunkResponse response = service.chunk("m1", "raw/m1.txt", "custom/run-7");

    assertThat(response.metadataKey()).isEqualTo("custom/run-7/chunks/metadata.json");
    assertThat(store.get("custom/run-7/chunks/chunk_0.txt")).isEqualTo("abcdefghij");
  }

  @Test
  void chunk_shouldPropagateMissingTranscript() {
    assertThatThrownBy(() -> service.chunk("m1", "raw/missing.txt", null))
        .isInstanceOf(ObjectNotFoundException.class);
  }

  @Test
  void preview_shouldNotWriteAnything() {
    ChunkPreviewResponse preview = service.preview("abcdefghijklmnopqrstuvwxyz", null, null);

    assertThat(preview.totalChars()).isEqualTo(26);
    assertThat(preview.chunkCount()).isEqualTo(3);
    assertThat(preview.chunks().get(1).start()).isEqualTo(8);
    assertThat(store.objects()).isEmpty();
  }

  @Test
  void preview_shouldApplyBudgetOverrides() {
    ChunkPreviewResponse preview = service.preview("abcdefghijklmnopqrstuvwxyz", 13, 0);

    assertThat(preview.chunks())
        .extracting(ChunkPreviewResponse.ChunkView::end)
        .containsExactly(13, 26);
  }

  @Test
  void preview_shouldRejectInconsistentOverrides() {
    assertThatThrownBy(() -> service.preview("text", 5, 5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
