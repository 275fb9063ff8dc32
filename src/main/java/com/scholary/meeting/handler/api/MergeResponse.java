package com.scholary.meeting.handler.api;

/** Result of the merge step. */
public record MergeResponse(
    String meetingId,
    String outputKey,
    int totalTurns,
    int chunkCount,
    String strategy,
    int validationErrors) {}
