package com.scholary.meeting.handler.transcript;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Role of a turn in the conversation, as labelled by the analysis step. */
public enum TurnType {
  QUESTION,
  ANSWER,
  FOLLOWUP,
  MONOLOGUE,
  HOUSEKEEPING;

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Lenient lookup: unknown or missing labels map to null instead of failing the document. */
  @JsonCreator
  public static TurnType fromJson(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
