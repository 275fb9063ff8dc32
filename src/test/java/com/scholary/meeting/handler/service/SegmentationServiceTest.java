package com.scholary.meeting.handler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.handler.api.SegmentRequest;
import com.scholary.meeting.handler.api.SegmentResponse;
import com.scholary.meeting.handler.objectstore.ObjectNotFoundException;
import com.scholary.meeting.handler.objectstore.ObjectStoreClient;
import com.scholary.meeting.handler.objectstore.ObjectStoreProperties;
import com.scholary.meeting.handler.segment.TurnSegmenter;
import com.scholary.meeting.handler.token.HeuristicTokenEstimator;
import com.scholary.meeting.handler.transcript.Turn;
import com.scholary.meeting.handler.transcript.TurnType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SegmentationServiceTest {

  @Mock private ObjectStoreClient objectStoreClient;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private InMemoryObjectStore store;
  private SegmentationService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryObjectStore(objectStoreClient);
    service =
        new SegmentationService(
            new ArtifactStore(objectMapper, objectStoreClient),
            new TurnSegmenter(new HeuristicTokenEstimator(4), 10),
            new ObjectStoreProperties(
                "http://localhost:9000", "admin", "admin123", "test-bucket", "us-east-1", true));
  }

  @Test
  void segment_shouldUseInlineTurns() throws Exception {
    List<Turn> turns =
        List.of(Turn.of("Alice", "x".repeat(40)), Turn.of("Bob", "y".repeat(8)));

    SegmentResponse response = service.segment(new SegmentRequest("m1", turns, null, null, null));

    assertThat(response.segmentCount()).isEqualTo(2);
    assertThat(response.outputKey()).isNull();
    assertThat(store.objects()).isEmpty();
  }

  @Test
  void segment_shouldReadMergedTurnsByDefaultAndSave() throws Exception {
    store.put(
        "meetings/m1/01_turns.json",
        objectMapper.writeValueAsString(
            new TurnsDocument(
                List.of(
                    new Turn(0, "00:00:01", "00:00:03", "Alice", TurnType.QUESTION, 0.8, "Why?"),
                    new Turn(1, "00:00:04", "00:00:09", "Bob", TurnType.ANSWER, 0.1, "Because.")),
                null)));

    SegmentResponse response = service.segment(new SegmentRequest("m1", null, null, null, true));

    assertThat(response.segmentCount()).isEqualTo(1);
    assertThat(response.outputKey()).isEqualTo("meetings/m1/02_segments.json");

    JsonNode saved = objectMapper.readTree(store.get("meetings/m1/02_segments.json"));
    assertThat(saved.get("total_segments").asInt()).isEqualTo(1);
    JsonNode segment = saved.get("segments").get(0);
    assertThat(segment.get("id").asInt()).isEqualTo(1);
    assertThat(segment.get("start_time").asDouble()).isEqualTo(1.0);
    assertThat(segment.get("end_time").asDouble()).isEqualTo(9.0);
    assertThat(segment.get("speakers").size()).isEqualTo(2);
    assertThat(segment.has("turns")).isFalse();
  }

  @Test
  void segment_shouldPropagateMissingTurnsDocument() {
    assertThatThrownBy(
            () -> service.segment(new SegmentRequest("m1", null, "missing.json", null, false)))
        .isInstanceOf(ObjectNotFoundException.class);
  }
}
