package com.scholary.meeting.handler.service;

/**
 * Object key layout for one meeting.
 *
 * <pre>
 * meetings/{id}/chunks/chunk_0.txt
 * meetings/{id}/chunks/chunk_0_overlap.txt
 * meetings/{id}/chunks/metadata.json
 * meetings/{id}/chunk_0_turns.json     written by the analysis step
 * meetings/{id}/01_turns.json          merged turns
 * meetings/{id}/02_segments.json
 * </pre>
 */
public final class MeetingKeys {

  private MeetingKeys() {}

  /** Default prefix when the caller does not supply one; always ends with '/'. */
  public static String prefix(String meetingId, String requestedPrefix) {
    String prefix =
        requestedPrefix == null || requestedPrefix.isBlank()
            ? "meetings/" + meetingId + "/"
            : requestedPrefix;
    return prefix.endsWith("/") ? prefix : prefix + "/";
  }

  public static String chunkText(String prefix, int chunkIndex) {
    return prefix + "chunks/chunk_" + chunkIndex + ".txt";
  }

  public static String chunkOverlap(String prefix, int chunkIndex) {
    return prefix + "chunks/chunk_" + chunkIndex + "_overlap.txt";
  }

  public static String chunkMetadata(String prefix) {
    return prefix + "chunks/metadata.json";
  }

  public static String chunkTurns(String prefix, int chunkIndex) {
    return prefix + "chunk_" + chunkIndex + "_turns.json";
  }

  public static String mergedTurns(String prefix) {
    return prefix + "01_turns.json";
  }

  public static String segments(String prefix) {
    return prefix + "02_segments.json";
  }
}
