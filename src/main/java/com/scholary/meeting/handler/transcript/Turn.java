package com.scholary.meeting.handler.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One attributed utterance extracted from a chunk by the analysis step.
 *
 * <p>{@code idx} is chunk-local until the merge re-sequences it. Any field may be missing in
 * input from the analysis step; the constraints are only checked after merging, and violations
 * are reported, not enforced.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Turn(
    @JsonProperty("idx") @Min(0) int idx,
    @JsonProperty("start_ts") @NotBlank String startTs,
    @JsonProperty("end_ts") @NotBlank String endTs,
    @JsonProperty("speaker") @NotBlank String speaker,
    @JsonProperty("type") @NotNull TurnType type,
    @JsonProperty("question_likelihood") @NotNull @DecimalMin("0.0") @DecimalMax("1.0")
        Double questionLikelihood,
    @JsonProperty("text") @NotNull String text) {

  /** Convenience for turns where only speaker and text matter. */
  public static Turn of(String speaker, String text) {
    return new Turn(0, null, null, speaker, null, null, text);
  }

  public Turn withIdx(int newIdx) {
    return new Turn(newIdx, startTs, endTs, speaker, type, questionLikelihood, text);
  }

  public Turn withStartTs(String newStartTs) {
    return new Turn(idx, newStartTs, endTs, speaker, type, questionLikelihood, text);
  }
}
