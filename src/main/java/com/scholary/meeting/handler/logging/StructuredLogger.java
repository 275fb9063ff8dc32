package com.scholary.meeting.handler.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Pipeline events logged with their fields in the MDC.
 *
 * <p>Event fields live only for the one log call that carries them. The meeting context is
 * longer lived and is set and cleared by the services around a whole request.
 */
public class StructuredLogger {

  private static final String MEETING_ID = "meetingId";
  private static final String SOURCE_KEY = "sourceKey";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  public void logChunkPlanned(
      int chunkIndex, int start, int end, int overlapStart, boolean nudged, int nudgeDelta) {
    Map<String, Object> fields = event("chunk_planned");
    fields.put("chunk_index", chunkIndex);
    fields.put("start", start);
    fields.put("end", end);
    fields.put("overlap_start", overlapStart);
    fields.put("nudge_delta", nudgeDelta);
    withFields(
        fields,
        () ->
            logger.debug(
                "Planned chunk {} [{}-{}) overlapStart={}{}",
                chunkIndex,
                start,
                end,
                overlapStart,
                nudged ? " (moved " + nudgeDelta + " chars to a break)" : ""));
  }

  public void logOverlapMerge(
      int leftChunk, int rightChunk, int lookbackTurns, int duplicatesMerged, int turnsAdded) {
    Map<String, Object> fields = event("overlap_merge");
    fields.put("chunk_index", rightChunk);
    fields.put("lookback_turns", lookbackTurns);
    fields.put("duplicates", duplicatesMerged);
    fields.put("turns_added", turnsAdded);
    withFields(
        fields,
        () ->
            logger.info(
                "Joined chunk {} onto chunk {}: {} duplicates absorbed in the last {} turns, {}"
                    + " turns appended",
                rightChunk,
                leftChunk,
                duplicatesMerged,
                lookbackTurns,
                turnsAdded));
  }

  /** Oversized segments are logged at WARN; a single long turn is the usual cause. */
  public void logSegmentBuilt(int segmentId, int turnCount, int estimatedTokens, int ceiling) {
    Map<String, Object> fields = event("segment_built");
    fields.put("segment_id", segmentId);
    fields.put("turn_count", turnCount);
    fields.put("estimated_tokens", estimatedTokens);
    withFields(
        fields,
        () -> {
          if (estimatedTokens > ceiling) {
            logger.warn(
                "Segment {} holds {} turns at ~{} tokens, over the {} token ceiling",
                segmentId,
                turnCount,
                estimatedTokens,
                ceiling);
          } else {
            logger.debug("Segment {}: {} turns, ~{} tokens", segmentId, turnCount, estimatedTokens);
          }
        });
  }

  public void logChunkResultReceived(String meetingId, int chunkIndex, int turnCount) {
    Map<String, Object> fields = event("chunk_result_received");
    fields.put(MEETING_ID, meetingId);
    fields.put("chunk_index", chunkIndex);
    fields.put("turn_count", turnCount);
    withFields(
        fields,
        () ->
            logger.info(
                "Stored {} turns for chunk {} of meeting {}", turnCount, chunkIndex, meetingId));
  }

  /**
   * Tag every log line on this thread with the meeting until {@link #clearMeetingContext()}.
   *
   * @param sourceKey object key the request reads from, may be null
   */
  public static void setMeetingContext(String meetingId, String sourceKey) {
    MDC.put(MEETING_ID, meetingId);
    if (sourceKey != null) {
      MDC.put(SOURCE_KEY, sourceKey);
    }
  }

  public static void clearMeetingContext() {
    MDC.remove(MEETING_ID);
    MDC.remove(SOURCE_KEY);
  }

  private static Map<String, Object> event(String type) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event_type", type);
    return fields;
  }

  // MDC values shadowed by the event are restored afterwards.
  private static void withFields(Map<String, Object> fields, Runnable log) {
    Map<String, String> previous = new LinkedHashMap<>();
    fields.forEach(
        (name, value) -> {
          previous.put(name, MDC.get(name));
          MDC.put(name, String.valueOf(value));
        });
    try {
      log.run();
    } finally {
      previous.forEach(
          (name, value) -> {
            if (value == null) {
              MDC.remove(name);
            } else {
              MDC.put(name, value);
            }
          });
    }
  }
}
