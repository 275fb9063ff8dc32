package com.scholary.meeting.handler.service;

import com.scholary.meeting.handler.api.MergeRequest;
import com.scholary.meeting.handler.api.MergeResponse;
import com.scholary.meeting.handler.cache.ChunkResultCache;
import com.scholary.meeting.handler.logging.StructuredLogger;
import com.scholary.meeting.handler.metadata.ChunkMetadata;
import com.scholary.meeting.handler.metadata.ChunkMetadata.ChunkEntry;
import com.scholary.meeting.handler.objectstore.ObjectNotFoundException;
import com.scholary.meeting.handler.objectstore.ObjectStoreProperties;
import com.scholary.meeting.handler.service.TurnsDocument.MergeInfo;
import com.scholary.meeting.handler.strategy.MergePlan;
import com.scholary.meeting.handler.strategy.MergeStrategy;
import com.scholary.meeting.handler.transcript.ChunkTurns;
import com.scholary.meeting.handler.transcript.MissingChunkResultException;
import com.scholary.meeting.handler.transcript.OverlapTurnMerger;
import com.scholary.meeting.handler.transcript.PassThroughMerger;
import com.scholary.meeting.handler.transcript.Turn;
import com.scholary.meeting.handler.transcript.TurnsValidator;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Collects per-chunk analysis results and merges them into one turns document.
 *
 * <p>Chunk results come from the result cache when a worker submitted them through the API, and
 * otherwise from the chunk's output key in the object store. A chunk found in neither place
 * aborts the merge.
 */
@Service
public class TurnMergeService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TurnMergeService.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final ArtifactStore artifactStore;
  private final ChunkResultCache chunkResultCache;
  private final OverlapTurnMerger overlapTurnMerger;
  private final PassThroughMerger passThroughMerger;
  private final TurnsValidator turnsValidator;
  private final String bucket;

  public TurnMergeService(
      ArtifactStore artifactStore,
      ChunkResultCache chunkResultCache,
      OverlapTurnMerger overlapTurnMerger,
      PassThroughMerger passThroughMerger,
      TurnsValidator turnsValidator,
      ObjectStoreProperties objectStoreProperties) {
    this.artifactStore = artifactStore;
    this.chunkResultCache = chunkResultCache;
    this.overlapTurnMerger = overlapTurnMerger;
    this.passThroughMerger = passThroughMerger;
    this.turnsValidator = turnsValidator;
    this.bucket = objectStoreProperties.bucket();
  }

  /**
   * Record one chunk's turns. A later submission for the same chunk replaces the earlier one.
   *
   * @return the number of turns kept
   */
  public int submitChunkResult(String meetingId, int chunkIndex, List<Turn> turns) {
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("Chunk index cannot be negative: " + chunkIndex);
    }
    List<Turn> kept = new ChunkTurns(chunkIndex, turns).turns();
    chunkResultCache.put(meetingId, chunkIndex, kept);
    STRUCTURED.logChunkResultReceived(meetingId, chunkIndex, kept.size());
    return kept.size();
  }

  /**
   * Merge a meeting's chunk results and write the merged turns document.
   *
   * @throws MissingChunkResultException if a chunk has no result anywhere
   * @throws IOException if metadata or a chunk result cannot be read or parsed
   */
  public MergeResponse merge(MergeRequest request) throws IOException {
    String meetingId = request.meetingId();
    StructuredLogger.setMeetingContext(meetingId, request.metadataKey());
    try {
      String prefix = MeetingKeys.prefix(meetingId, request.outputPrefix());
      String outputKey =
          request.outputKey() == null || request.outputKey().isBlank()
              ? MeetingKeys.mergedTurns(prefix)
              : request.outputKey();

      MergeStrategy strategy;
      MergePlan plan;
      List<ChunkTurns> results = new ArrayList<>();

      if (request.chunked()) {
        String metadataKey =
            request.metadataKey() == null || request.metadataKey().isBlank()
                ? MeetingKeys.chunkMetadata(prefix)
                : request.metadataKey();
        ChunkMetadata metadata = artifactStore.readJson(bucket, metadataKey, ChunkMetadata.class);
        LOGGER.info("Loaded chunk metadata: {} chunks from {}", metadata.chunkCount(), metadataKey);

        for (ChunkEntry entry : metadata.chunks()) {
          String resultKey =
              entry.outputKey() != null
                  ? entry.outputKey()
                  : MeetingKeys.chunkTurns(prefix, entry.chunkIndex());
          results.add(loadChunkResult(meetingId, entry.chunkIndex(), resultKey));
        }
        strategy = overlapTurnMerger;
        plan = MergePlan.from(metadata);
      } else {
        results.add(loadChunkResult(meetingId, 0, MeetingKeys.chunkTurns(prefix, 0)));
        strategy = passThroughMerger;
        plan = MergePlan.unchunked();
      }

      List<Turn> merged = strategy.merge(results, plan);
      List<String> validationErrors = turnsValidator.validate(merged);

      TurnsDocument document =
          new TurnsDocument(
              merged,
              new MergeInfo(
                  meetingId,
                  merged.size(),
                  plan.chunkCount(),
                  strategy.getStrategyName(),
                  validationErrors,
                  Instant.now().toString()));
      artifactStore.writeJson(bucket, outputKey, document);
      chunkResultCache.evictMeeting(meetingId);

      LOGGER.info(
          "Merged {} turns from {} chunks using {} into {}",
          merged.size(),
          plan.chunkCount(),
          strategy.getStrategyName(),
          outputKey);

      return new MergeResponse(
          meetingId,
          outputKey,
          merged.size(),
          plan.chunkCount(),
          strategy.getStrategyName(),
          validationErrors.size());
    } finally {
      StructuredLogger.clearMeetingContext();
    }
  }

  private ChunkTurns loadChunkResult(String meetingId, int chunkIndex, String resultKey)
      throws IOException {
    Optional<List<Turn>> cached = chunkResultCache.get(meetingId, chunkIndex);
    if (cached.isPresent()) {
      LOGGER.debug("Chunk {} result taken from cache", chunkIndex);
      return new ChunkTurns(chunkIndex, cached.get());
    }

    try {
      TurnsDocument document = artifactStore.readJson(bucket, resultKey, TurnsDocument.class);
      LOGGER.debug("Chunk {} result read from {}", chunkIndex, resultKey);
      return new ChunkTurns(chunkIndex, document.turns());
    } catch (ObjectNotFoundException e) {
      throw new MissingChunkResultException(
          chunkIndex,
          String.format(
              "No result for chunk %d: not submitted and %s does not exist", chunkIndex, resultKey),
          e);
    }
  }
}
