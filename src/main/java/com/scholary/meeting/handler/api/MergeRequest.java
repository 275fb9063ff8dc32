package com.scholary.meeting.handler.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to merge per-chunk results of a meeting.
 *
 * <p>{@code chunked} defaults to true. {@code metadataKey} defaults to the chunk metadata under
 * the meeting prefix and is ignored for unchunked transcripts.
 */
public record MergeRequest(
    @NotBlank String meetingId,
    Boolean chunked,
    String metadataKey,
    String outputPrefix,
    String outputKey) {

  public MergeRequest {
    if (chunked == null) {
      chunked = true;
    }
  }
}
