package com.scholary.meeting.handler.segment;

/** Parses {@code HH:MM:SS} turn timestamps. */
public final class TimestampParser {

  private TimestampParser() {}

  /**
   * Convert a timestamp to seconds.
   *
   * <p>Each component may be fractional ({@code 00:01:02.5}). Anything other than exactly three
   * numeric components yields null.
   *
   * @param timestamp the timestamp, may be null
   * @return seconds, or null if the timestamp cannot be parsed
   */
  public static Double toSeconds(String timestamp) {
    if (timestamp == null || timestamp.isEmpty()) {
      return null;
    }
    String[] parts = timestamp.split(":", -1);
    if (parts.length != 3) {
      return null;
    }
    try {
      double hours = Double.parseDouble(parts[0]);
      double minutes = Double.parseDouble(parts[1]);
      double seconds = Double.parseDouble(parts[2]);
      return hours * 3600 + minutes * 60 + seconds;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
