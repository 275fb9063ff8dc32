package com.scholary.meeting.handler.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to chunk a stored transcript.
 *
 * <p>{@code outputPrefix} defaults to {@code meetings/{meetingId}/}.
 */
public record ChunkRequest(@NotBlank String meetingId, @NotBlank String inputKey, String outputPrefix) {}
