package com.scholary.meeting.handler.service;

import com.scholary.meeting.handler.api.ChunkPreviewResponse;
import com.scholary.meeting.handler.api.ChunkPreviewResponse.ChunkView;
import com.scholary.meeting.handler.api.ChunkResponse;
import com.scholary.meeting.handler.chunking.ChunkingParameters;
import com.scholary.meeting.handler.chunking.TextChunk;
import com.scholary.meeting.handler.chunking.TextChunker;
import com.scholary.meeting.handler.config.PipelineProperties;
import com.scholary.meeting.handler.logging.StructuredLogger;
import com.scholary.meeting.handler.metadata.ChunkMetadata;
import com.scholary.meeting.handler.metadata.ChunkMetadata.ChunkEntry;
import com.scholary.meeting.handler.metadata.ChunkMetadata.ChunkingParams;
import com.scholary.meeting.handler.objectstore.ObjectStoreProperties;
import com.scholary.meeting.handler.token.HeuristicTokenEstimator;
import com.scholary.meeting.handler.token.TokenEstimator;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Splits a stored transcript into overlapping chunks and writes them back with a metadata record.
 *
 * <p>Transcripts at or under the chunking threshold are left alone: the response carries one
 * entry pointing at the original key and nothing is written.
 */
@Service
public class TranscriptChunkingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptChunkingService.class);
  private static final TokenEstimator QUICK_ESTIMATOR = HeuristicTokenEstimator.quick();

  private final ArtifactStore artifactStore;
  private final TextChunker textChunker;
  private final TokenEstimator tokenEstimator;
  private final String bucket;
  private final int chunkingThresholdTokens;

  public TranscriptChunkingService(
      ArtifactStore artifactStore,
      TextChunker textChunker,
      TokenEstimator tokenEstimator,
      ObjectStoreProperties objectStoreProperties,
      PipelineProperties pipelineProperties) {
    this.artifactStore = artifactStore;
    this.textChunker = textChunker;
    this.tokenEstimator = tokenEstimator;
    this.bucket = objectStoreProperties.bucket();
    this.chunkingThresholdTokens = pipelineProperties.chunking().chunkingThresholdTokens();
  }

  /**
   * Chunk the transcript stored at {@code inputKey}.
   *
   * @param meetingId the meeting
   * @param inputKey key of the full transcript text
   * @param outputPrefix where chunk files go; null for {@code meetings/{meetingId}/}
   * @return the chunk layout
   * @throws IOException if the transcript cannot be read or the metadata cannot be serialized
   */
  public ChunkResponse chunk(String meetingId, String inputKey, String outputPrefix)
      throws IOException {
    StructuredLogger.setMeetingContext(meetingId, inputKey);
    try {
      String prefix = MeetingKeys.prefix(meetingId, outputPrefix);
      String text = artifactStore.readText(bucket, inputKey);
      int estimatedTokens = estimateTokens(text);

      if (!TextChunker.needsChunking(estimatedTokens, chunkingThresholdTokens)) {
        LOGGER.info(
            "Transcript under threshold ({} tokens), not chunking", chunkingThresholdTokens);
        ChunkEntry single =
            new ChunkEntry(
                0,
                inputKey,
                null,
                MeetingKeys.chunkTurns(prefix, 0),
                0,
                text.length(),
                text.length(),
                estimatedTokens,
                false);
        return new ChunkResponse(meetingId, false, 1, estimatedTokens, null, List.of(single));
      }

      List<TextChunk> chunks = textChunker.chunk(text);
      List<ChunkEntry> entries = new ArrayList<>(chunks.size());

      for (TextChunk chunk : chunks) {
        String chunkKey = MeetingKeys.chunkText(prefix, chunk.index());
        artifactStore.writeText(bucket, chunkKey, chunk.text());

        String overlapKey = null;
        if (!chunk.overlapText().isEmpty()) {
          overlapKey = MeetingKeys.chunkOverlap(prefix, chunk.index());
          artifactStore.writeText(bucket, overlapKey, chunk.overlapText());
        }

        entries.add(
            ChunkEntry.of(
                chunk, chunkKey, overlapKey, MeetingKeys.chunkTurns(prefix, chunk.index())));
      }

      ChunkMetadata metadata =
          new ChunkMetadata(
              meetingId,
              inputKey,
              entries.size(),
              text.length(),
              estimatedTokens,
              tokenEstimator.name(),
              ChunkingParams.from(textChunker.parameters()),
              entries,
              Instant.now().toString());

      String metadataKey = MeetingKeys.chunkMetadata(prefix);
      artifactStore.writeJson(bucket, metadataKey, metadata);

      LOGGER.info("Wrote {} chunks and metadata to {}", entries.size(), metadataKey);

      return new ChunkResponse(
          meetingId, true, entries.size(), estimatedTokens, metadataKey, entries);
    } finally {
      StructuredLogger.clearMeetingContext();
    }
  }

  // The quick estimate overcounts, so a transcript it puts under the threshold is left unchunked
  // without running the configured estimator.
  private int estimateTokens(String text) {
    int quickEstimate = QUICK_ESTIMATOR.estimate(text);
    if (!TextChunker.needsChunking(quickEstimate, chunkingThresholdTokens)) {
      LOGGER.info(
          "Loaded transcript: {} chars, ~{} tokens ({})",
          text.length(),
          quickEstimate,
          QUICK_ESTIMATOR.name());
      return quickEstimate;
    }
    int estimatedTokens = tokenEstimator.estimate(text);
    LOGGER.info(
        "Loaded transcript: {} chars, ~{} tokens ({})",
        text.length(),
        estimatedTokens,
        tokenEstimator.name());
    return estimatedTokens;
  }

  /**
   * Show where the text would be cut, without touching storage.
   *
   * @param text the transcript
   * @param chunkSizeTokens budget override, or null for the configured one
   * @param overlapTokens overlap override, or null for the configured one
   * @throws IllegalArgumentException if the overrides are inconsistent
   */
  public ChunkPreviewResponse preview(String text, Integer chunkSizeTokens, Integer overlapTokens) {
    TextChunker chunker = textChunker;
    if (chunkSizeTokens != null || overlapTokens != null) {
      ChunkingParameters configured = textChunker.parameters();
      chunker =
          new TextChunker(
              new ChunkingParameters(
                  chunkSizeTokens != null ? chunkSizeTokens : configured.chunkSizeTokens(),
                  overlapTokens != null ? overlapTokens : configured.overlapTokens(),
                  configured.charsPerToken(),
                  configured.searchRadiusChars()));
    }

    List<ChunkView> views =
        chunker.chunk(text).stream()
            .map(
                chunk ->
                    new ChunkView(
                        chunk.index(),
                        chunk.startOffset(),
                        chunk.endOffset(),
                        chunk.overlapStartOffset(),
                        chunk.estimatedTokens(),
                        chunk.hasNext()))
            .toList();

    return new ChunkPreviewResponse(text.length(), views.size(), views);
  }
}
