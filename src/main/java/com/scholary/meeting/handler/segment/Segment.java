package com.scholary.meeting.handler.segment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.handler.transcript.Turn;
import java.util.List;

/**
 * A contiguous run of turns sized for one segment-level analysis call.
 *
 * @param id 1-based, sequential
 * @param startTime seconds from the first turn's start timestamp, null if unparseable
 * @param endTime seconds from the last turn's end timestamp, null if unparseable
 * @param topic placeholder until a later analysis names it
 * @param speakers distinct speakers in first-seen order
 * @param text turn texts joined by newlines
 * @param turns the source turns, not part of the serialized document
 */
public record Segment(
    @JsonProperty("id") int id,
    @JsonProperty("start_time") Double startTime,
    @JsonProperty("end_time") Double endTime,
    @JsonProperty("topic") String topic,
    @JsonProperty("speakers") List<String> speakers,
    @JsonProperty("text") String text,
    @JsonIgnore List<Turn> turns) {

  public Segment {
    speakers = speakers == null ? List.of() : List.copyOf(speakers);
    turns = turns == null ? List.of() : List.copyOf(turns);
  }

  @JsonIgnore
  public int turnCount() {
    return turns.size();
  }
}
