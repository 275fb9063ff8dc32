package com.scholary.meeting.handler.chunking;

import com.scholary.meeting.handler.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a transcript into overlapping chunks at natural text boundaries.
 *
 * <p>Each chunk targets {@code chunkSizeChars}; the next one starts roughly {@code overlapChars}
 * before the previous end so that an utterance cut at a boundary appears whole in at least one
 * chunk. Both ends are moved onto paragraph or line breaks where one exists within the search
 * radius.
 *
 * <p>Example with 300-char chunks, 60-char overlap:
 *
 * <pre>
 * Chunk 0: [0, 302)    break found just past target 300
 * Chunk 1: [241, 545)  starts at a break near 240, ends near 540
 * Chunk 2: [482, 700)  last chunk, has_next=false
 * </pre>
 *
 * <p>Pure and stateless; safe to share.
 */
public class TextChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextChunker.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final ChunkingParameters parameters;
  private final NaturalBreakFinder breakFinder;

  public TextChunker(ChunkingParameters parameters) {
    this(parameters, new NaturalBreakFinder(parameters.searchRadiusChars()));
  }

  public TextChunker(ChunkingParameters parameters, NaturalBreakFinder breakFinder) {
    this.parameters = parameters;
    this.breakFinder = breakFinder;
  }

  /**
   * Split text into overlapping chunks.
   *
   * @param text the full transcript
   * @return chunks in index order; empty for null or empty text
   */
  public List<TextChunk> chunk(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    int total = text.length();
    int chunkChars = parameters.chunkSizeChars();
    int overlapChars = parameters.overlapChars();
    int stride = parameters.strideChars();

    LOGGER.info(
        "Chunking {} chars (est. {} tokens): chunkSize={} chars, overlap={} chars",
        total,
        total / parameters.charsPerToken(),
        chunkChars,
        overlapChars);

    List<TextChunk> chunks = new ArrayList<>();
    int cursor = 0;
    int index = 0;

    while (cursor < total) {
      int chunkStart = cursor;
      int targetEnd = Math.min(chunkStart + chunkChars, total);

      int chunkEnd = targetEnd;
      if (targetEnd < total) {
        chunkEnd = breakFinder.find(text, targetEnd);
        if (chunkEnd <= chunkStart) {
          chunkEnd = targetEnd;
        }
      }

      String chunkText = text.substring(chunkStart, chunkEnd);
      boolean hasNext = chunkEnd < total;

      int overlapStart = chunkEnd;
      String overlapText = "";
      if (hasNext) {
        overlapStart = Math.max(chunkStart, chunkEnd - overlapChars);
        overlapText = text.substring(overlapStart, chunkEnd);
      }

      chunks.add(
          new TextChunk(
              index,
              chunkText,
              chunkStart,
              chunkEnd,
              overlapStart,
              overlapText,
              chunkText.length() / parameters.charsPerToken(),
              hasNext));

      STRUCTURED.logChunkPlanned(
          index, chunkStart, chunkEnd, overlapStart, chunkEnd != targetEnd, chunkEnd - targetEnd);

      if (!hasNext) {
        break;
      }

      int nextTarget = chunkStart + stride;
      int candidate = nextTarget < total ? breakFinder.find(text, nextTarget) : total;
      cursor = clampNextStart(candidate, nextTarget, chunkStart, chunkEnd);
      index++;
    }

    LOGGER.info("Created {} chunks from {} character transcript", chunks.size(), total);
    return chunks;
  }

  /**
   * Keep the next start inside {@code (chunkStart, chunkEnd]}.
   *
   * <p>Below the range the loop would stall; above it the characters between the two chunks
   * would be lost.
   */
  private int clampNextStart(int candidate, int nextTarget, int chunkStart, int chunkEnd) {
    if (candidate > chunkEnd) {
      LOGGER.debug("Next start {} past chunk end {}, clamping", candidate, chunkEnd);
      return chunkEnd;
    }
    if (candidate <= chunkStart) {
      return Math.min(Math.max(nextTarget, chunkStart + 1), chunkEnd);
    }
    return candidate;
  }

  /**
   * Whether a text needs chunking at all under a token budget.
   *
   * @param estimatedTokens the whole transcript's estimate
   * @param thresholdTokens the analysis step's budget
   * @return true if the estimate exceeds the budget
   */
  public static boolean needsChunking(int estimatedTokens, int thresholdTokens) {
    return estimatedTokens > thresholdTokens;
  }

  public ChunkingParameters parameters() {
    return parameters;
  }
}
