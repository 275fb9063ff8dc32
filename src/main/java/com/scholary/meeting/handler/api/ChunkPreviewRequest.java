package com.scholary.meeting.handler.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request for previewing chunk boundaries of inline text without storing anything.
 *
 * <p>Unset budgets fall back to the configured ones.
 */
public record ChunkPreviewRequest(
    @NotNull String text, @Min(1) Integer chunkSizeTokens, @Min(0) Integer overlapTokens) {}
