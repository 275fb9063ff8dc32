package com.scholary.meeting.handler.chunking;

/**
 * Finds a paragraph or line boundary near a target offset.
 *
 * <p>Search order, first hit wins:
 *
 * <ol>
 *   <li>backward from the target for a blank line ({@code \n\n})
 *   <li>forward from the target for a blank line
 *   <li>backward for a single newline
 *   <li>forward for a single newline
 *   <li>the target offset itself
 * </ol>
 *
 * <p>The order is asymmetric: a paragraph break near the edge of the radius beats a line break
 * right at the target. Chunk boundaries must stay identical across implementations, so keep it.
 */
public class NaturalBreakFinder {

  private final int searchRadius;

  public NaturalBreakFinder(int searchRadius) {
    if (searchRadius < 0) {
      throw new IllegalArgumentException("Search radius cannot be negative");
    }
    this.searchRadius = searchRadius;
  }

  /**
   * Find the break offset closest in precedence to {@code target}.
   *
   * @param text the text being split
   * @param target the ideal split offset, {@code 0 <= target < text.length()}
   * @return the offset just past the chosen newline(s), or {@code target} if none was found
   */
  public int find(String text, int target) {
    int length = text.length();
    if (target < 0 || target >= length) {
      return target;
    }
    int lower = Math.max(0, target - searchRadius);
    int upper = Math.min(length, target + searchRadius);

    for (int i = target; i > lower; i--) {
      if (i + 1 < length && text.charAt(i) == '\n' && text.charAt(i + 1) == '\n') {
        return i + 2;
      }
    }
    for (int i = target; i < upper - 1; i++) {
      if (text.charAt(i) == '\n' && text.charAt(i + 1) == '\n') {
        return i + 2;
      }
    }
    for (int i = target; i > lower; i--) {
      if (text.charAt(i) == '\n') {
        return i + 1;
      }
    }
    for (int i = target; i < upper; i++) {
      if (text.charAt(i) == '\n') {
        return i + 1;
      }
    }
    return target;
  }
}
