package com.scholary.meeting.handler.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NaturalBreakFinderTest {

  private final NaturalBreakFinder finder = new NaturalBreakFinder(10);

  @Test
  void find_shouldPreferParagraphBreakBeforeTarget() {
    String text = "aaaa\n\nbbbb\ncccc";

    assertThat(finder.find(text, 8)).isEqualTo(6);
  }

  @Test
  void find_shouldPreferParagraphBreakAfterTargetOverLineBreakBefore() {
    // line break at 4, paragraph break at 13
    String text = "aaaa\nbbbbbbbb\n\ncc";

    assertThat(finder.find(text, 7)).isEqualTo(15);
  }

  @Test
  void find_shouldFallBackToLineBreakBeforeTarget() {
    String text = "aaaa\nbbbbbbbbbb";

    assertThat(finder.find(text, 8)).isEqualTo(5);
  }

  @Test
  void find_shouldFallBackToLineBreakAfterTarget() {
    String text = "aaaaaaaa\nbb";

    assertThat(finder.find(text, 3)).isEqualTo(9);
  }

  @Test
  void find_shouldReturnTargetWhenNoBreakExists() {
    assertThat(finder.find("abcdefghij", 5)).isEqualTo(5);
  }

  @Test
  void find_shouldIgnoreBreaksOutsideRadius() {
    NaturalBreakFinder narrow = new NaturalBreakFinder(3);
    String text = "a\n" + "a".repeat(20);

    assertThat(narrow.find(text, 15)).isEqualTo(15);
  }

  @Test
  void find_shouldReturnTargetWhenOutOfRange() {
    assertThat(finder.find("abc", 3)).isEqualTo(3);
  }

  @Test
  void constructor_shouldRejectNegativeRadius() {
    assertThatThrownBy(() -> new NaturalBreakFinder(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
