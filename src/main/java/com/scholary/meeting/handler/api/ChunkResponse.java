package com.scholary.meeting.handler.api;

import com.scholary.meeting.handler.metadata.ChunkMetadata.ChunkEntry;
import java.util.List;

/**
 * Result of the chunking step.
 *
 * <p>When {@code chunked} is false there is a single entry pointing at the original transcript
 * and no metadata record was written.
 */
public record ChunkResponse(
    String meetingId,
    boolean chunked,
    int chunkCount,
    int estimatedTokens,
    String metadataKey,
    List<ChunkEntry> chunks) {}
