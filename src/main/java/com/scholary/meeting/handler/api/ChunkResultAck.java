package com.scholary.meeting.handler.api;

/** Acknowledges a submitted chunk result. */
public record ChunkResultAck(String meetingId, int chunkIndex, int turnCount) {}
