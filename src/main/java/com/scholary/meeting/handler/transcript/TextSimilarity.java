package com.scholary.meeting.handler.transcript;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Word-set similarity for spotting the same utterance reported by two chunks.
 *
 * <p>Jaccard similarity (intersection / union) over lower-cased, whitespace-split words. Word
 * order is ignored, which tolerates the analysis step trimming or re-punctuating a sentence
 * differently in each chunk.
 */
public final class TextSimilarity {

  private TextSimilarity() {}

  /**
   * Collapse whitespace runs and lower-case.
   *
   * @param text the text, null treated as empty
   * @return normalized text
   */
  public static String normalizeText(String text) {
    if (text == null) {
      return "";
    }
    String stripped = text.strip();
    if (stripped.isEmpty()) {
      return "";
    }
    return String.join(" ", stripped.split("\\s+")).toLowerCase(Locale.ROOT);
  }

  /** Speaker names compare case- and padding-insensitively. */
  public static String normalizeSpeaker(String speaker) {
    return speaker == null ? "" : speaker.strip().toLowerCase(Locale.ROOT);
  }

  /**
   * Similarity between two texts.
   *
   * <p>Texts equal after normalization score 1.0; if either has no words the score is 0.0.
   *
   * @return a score in [0, 1], symmetric in its arguments
   */
  public static double similarity(String text1, String text2) {
    String norm1 = normalizeText(text1);
    String norm2 = normalizeText(text2);

    if (norm1.equals(norm2)) {
      return 1.0;
    }

    Set<String> words1 = words(norm1);
    Set<String> words2 = words(norm2);
    if (words1.isEmpty() || words2.isEmpty()) {
      return 0.0;
    }

    Set<String> intersection = new HashSet<>(words1);
    intersection.retainAll(words2);
    Set<String> union = new HashSet<>(words1);
    union.addAll(words2);

    return (double) intersection.size() / union.size();
  }

  private static Set<String> words(String normalized) {
    Set<String> words = new HashSet<>();
    if (normalized.isEmpty()) {
      return words;
    }
    for (String word : normalized.split(" ")) {
      words.add(word);
    }
    return words;
  }
}
