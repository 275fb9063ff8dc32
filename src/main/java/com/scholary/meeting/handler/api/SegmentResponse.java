package com.scholary.meeting.handler.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.handler.segment.Segment;
import java.util.List;

/** Segments built from a meeting's turns; {@code outputKey} is null unless saved. */
public record SegmentResponse(
    @JsonProperty("meeting_id") String meetingId,
    @JsonProperty("segment_count") int segmentCount,
    @JsonProperty("output_key") String outputKey,
    @JsonProperty("segments") List<Segment> segments) {}
