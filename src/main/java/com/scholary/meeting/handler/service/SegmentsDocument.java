package com.scholary.meeting.handler.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.handler.segment.Segment;
import java.util.List;

/** Stored form of a meeting's segments. */
public record SegmentsDocument(
    @JsonProperty("meeting_id") String meetingId,
    @JsonProperty("total_segments") int totalSegments,
    @JsonProperty("max_tokens_per_segment") int maxTokensPerSegment,
    @JsonProperty("segments") List<Segment> segments,
    @JsonProperty("created_at") String createdAt) {}
