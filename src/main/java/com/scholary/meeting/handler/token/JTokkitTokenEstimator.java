package com.scholary.meeting.handler.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counts from a real BPE tokenizer.
 *
 * <p>{@code cl100k_base} is not the analysis model's own vocabulary, but it tracks it closely
 * enough for budgeting. Special-token markers such as {@code <|endoftext|>} in a transcript are
 * counted as the ordinary text they are.
 */
public class JTokkitTokenEstimator implements TokenEstimator {

  private final Encoding encoding;
  private final EncodingType encodingType;

  public JTokkitTokenEstimator() {
    this(EncodingType.CL100K_BASE);
  }

  public JTokkitTokenEstimator(EncodingType encodingType) {
    this.encodingType = encodingType;
    this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(encodingType);
  }

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return encoding.countTokensOrdinary(text);
  }

  @Override
  public String name() {
    return "jtokkit-" + encodingType.getName();
  }
}
