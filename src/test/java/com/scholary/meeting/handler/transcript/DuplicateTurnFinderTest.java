package com.scholary.meeting.handler.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class DuplicateTurnFinderTest {

  private final DuplicateTurnFinder finder = new DuplicateTurnFinder(DuplicateTurnFinder.MERGE_THRESHOLD);

  @Test
  void isDuplicate_shouldRequireSameSpeaker() {
    Turn alice = Turn.of("Alice", "I have a question about that");
    Turn bob = Turn.of("Bob", "I have a question about that");

    assertThat(finder.isDuplicate(bob, alice)).isFalse();
  }

  @Test
  void isDuplicate_shouldCompareSpeakersIgnoringCase() {
    Turn existing = Turn.of("Alice", "Welcome everyone");
    Turn candidate = Turn.of(" alice ", "welcome   everyone");

    assertThat(finder.isDuplicate(candidate, existing)).isTrue();
  }

  @Test
  void isDuplicate_shouldApplyThreshold() {
    // 3 shared of 4 distinct words = 0.75
    Turn existing = Turn.of("Alice", "one two three");
    Turn candidate = Turn.of("Alice", "one two three four");

    assertThat(finder.isDuplicate(candidate, existing)).isTrue();
    assertThat(new DuplicateTurnFinder(0.8).isDuplicate(candidate, existing)).isFalse();
  }

  @Test
  void isDuplicate_shouldTreatMissingFieldsAsEmpty() {
    Turn blank = new Turn(0, null, null, null, null, null, null);

    assertThat(finder.isDuplicate(blank, blank)).isTrue();
    assertThat(finder.isDuplicate(blank, Turn.of(null, "text"))).isFalse();
  }

  @Test
  void indexOfDuplicate_shouldSearchOnlyGivenRange() {
    List<Turn> turns =
        List.of(Turn.of("Alice", "hello"), Turn.of("Bob", "hi"), Turn.of("Alice", "hello"));

    assertThat(finder.indexOfDuplicate(Turn.of("Alice", "hello"), turns, 0, 3)).isEqualTo(0);
    assertThat(finder.indexOfDuplicate(Turn.of("Alice", "hello"), turns, 1, 3)).isEqualTo(2);
    assertThat(finder.indexOfDuplicate(Turn.of("Alice", "hello"), turns, 1, 2)).isEqualTo(-1);
  }

  @Test
  void constructor_shouldRejectThresholdOutsideUnitInterval() {
    assertThatThrownBy(() -> new DuplicateTurnFinder(1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
