package com.scholary.meeting.handler.cache;

import com.scholary.meeting.handler.transcript.Turn;
import java.util.List;
import java.util.Optional;

/**
 * Holds per-chunk analysis results until the merge step runs.
 *
 * <p>Analysis calls fan out per chunk and complete (or get retried) in any order. Each result is
 * stored under its meeting and chunk index, and the merge step collects them by index.
 */
public interface ChunkResultCache {

  /**
   * Store a chunk's turns, replacing any earlier result for the same chunk.
   *
   * @param meetingId the meeting
   * @param chunkIndex the chunk index
   * @param turns the turns produced for that chunk
   */
  void put(String meetingId, int chunkIndex, List<Turn> turns);

  /**
   * Retrieve a chunk's turns.
   *
   * @param meetingId the meeting
   * @param chunkIndex the chunk index
   * @return the turns, or empty if no result was submitted
   */
  Optional<List<Turn>> get(String meetingId, int chunkIndex);

  /**
   * Drop all results for a meeting, typically after a successful merge.
   *
   * @param meetingId the meeting
   */
  void evictMeeting(String meetingId);

  /**
   * Generate a cache key for a chunk result.
   *
   * @param meetingId the meeting
   * @param chunkIndex the chunk index
   * @return a unique cache key
   */
  static String generateKey(String meetingId, int chunkIndex) {
    return String.format("%s:chunk-%d", meetingId, chunkIndex);
  }

  /**
   * Generate a prefix matching every chunk of a meeting.
   *
   * @param meetingId the meeting
   * @return the key prefix
   */
  static String generateMeetingPrefix(String meetingId) {
    return meetingId + ":";
  }
}
