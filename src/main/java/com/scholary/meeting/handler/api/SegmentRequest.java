package com.scholary.meeting.handler.api;

import com.scholary.meeting.handler.transcript.Turn;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Request to group turns into segments.
 *
 * <p>Either supply {@code turns} inline or point {@code turnsKey} at a turns document. With
 * {@code save} the segments are written next to the merged turns.
 */
public record SegmentRequest(
    @NotBlank String meetingId,
    List<Turn> turns,
    String turnsKey,
    String outputPrefix,
    Boolean save) {

  public SegmentRequest {
    if (save == null) {
      save = false;
    }
  }
}
