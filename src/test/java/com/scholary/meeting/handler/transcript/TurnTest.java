package com.scholary.meeting.handler.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class TurnTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void deserialize_shouldReadSnakeCaseFields() throws Exception {
    String json =
        """
        {"idx": 3, "start_ts": "00:01:02", "end_ts": "00:01:09", "speaker": "Alice",
         "type": "Question", "question_likelihood": 0.9, "text": "Any news?", "extra": true}
        """;

    Turn turn = objectMapper.readValue(json, Turn.class);

    assertThat(turn.idx()).isEqualTo(3);
    assertThat(turn.startTs()).isEqualTo("00:01:02");
    assertThat(turn.type()).isEqualTo(TurnType.QUESTION);
    assertThat(turn.questionLikelihood()).isEqualTo(0.9);
  }

  @Test
  void deserialize_shouldTolerateUnknownTypeAndMissingFields() throws Exception {
    Turn turn = objectMapper.readValue("{\"type\": \"banter\", \"text\": \"ha\"}", Turn.class);

    assertThat(turn.type()).isNull();
    assertThat(turn.speaker()).isNull();
    assertThat(turn.idx()).isZero();
  }

  @Test
  void serialize_shouldWriteLowerCaseType() throws Exception {
    Turn turn = new Turn(0, "00:00:01", "00:00:02", "Bob", TurnType.FOLLOWUP, 0.4, "And then?");

    String json = objectMapper.writeValueAsString(turn);

    assertThat(json).contains("\"type\":\"followup\"").contains("\"start_ts\":\"00:00:01\"");
  }
}
