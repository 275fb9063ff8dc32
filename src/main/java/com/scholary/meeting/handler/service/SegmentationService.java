package com.scholary.meeting.handler.service;

import com.scholary.meeting.handler.api.SegmentRequest;
import com.scholary.meeting.handler.api.SegmentResponse;
import com.scholary.meeting.handler.logging.StructuredLogger;
import com.scholary.meeting.handler.objectstore.ObjectStoreProperties;
import com.scholary.meeting.handler.segment.Segment;
import com.scholary.meeting.handler.segment.TurnSegmenter;
import com.scholary.meeting.handler.transcript.Turn;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Groups a meeting's turns into segments.
 *
 * <p>Turns are taken from the request when given, otherwise from a turns document in the object
 * store (by default the merged turns under the meeting prefix).
 */
@Service
public class SegmentationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentationService.class);

  private final ArtifactStore artifactStore;
  private final TurnSegmenter turnSegmenter;
  private final String bucket;

  public SegmentationService(
      ArtifactStore artifactStore,
      TurnSegmenter turnSegmenter,
      ObjectStoreProperties objectStoreProperties) {
    this.artifactStore = artifactStore;
    this.turnSegmenter = turnSegmenter;
    this.bucket = objectStoreProperties.bucket();
  }

  public SegmentResponse segment(SegmentRequest request) throws IOException {
    String meetingId = request.meetingId();
    StructuredLogger.setMeetingContext(meetingId, request.turnsKey());
    try {
      String prefix = MeetingKeys.prefix(meetingId, request.outputPrefix());
      List<Turn> turns = loadTurns(request, prefix);

      List<Segment> segments = turnSegmenter.segment(turns);
      LOGGER.info("Built {} segments from {} turns", segments.size(), turns.size());

      String outputKey = null;
      if (request.save()) {
        outputKey = MeetingKeys.segments(prefix);
        artifactStore.writeJson(
            bucket,
            outputKey,
            new SegmentsDocument(
                meetingId,
                segments.size(),
                turnSegmenter.maxTokensPerSegment(),
                segments,
                Instant.now().toString()));
        LOGGER.info("Wrote segments to {}", outputKey);
      }

      return new SegmentResponse(meetingId, segments.size(), outputKey, segments);
    } finally {
      StructuredLogger.clearMeetingContext();
    }
  }

  private List<Turn> loadTurns(SegmentRequest request, String prefix) throws IOException {
    List<Turn> turns;
    if (request.turns() != null) {
      turns = request.turns();
    } else {
      String turnsKey =
          request.turnsKey() == null || request.turnsKey().isBlank()
              ? MeetingKeys.mergedTurns(prefix)
              : request.turnsKey();
      turns = artifactStore.readJson(bucket, turnsKey, TurnsDocument.class).turns();
      LOGGER.info("Loaded {} turns from {}", turns.size(), turnsKey);
    }
    return turns.stream().filter(Objects::nonNull).toList();
  }
}
