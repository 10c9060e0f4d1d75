package dev.quire.chunking.size;

import dev.quire.document.LineIndexedDocument;

/**
 * Character-based token estimation (chars / 4), the usual approximation for English text and
 * markup.
 *
 * <p>Range sizes come straight from the document's line offsets, so sizing never copies text.
 */
public final class CharacterRatioEstimator implements SizeEstimator {

  static final double CHARS_PER_TOKEN = 4.0;

  @Override
  public int estimateText(CharSequence text) {
    return tokensFor(text.length());
  }

  @Override
  public DocumentSizer forDocument(LineIndexedDocument document) {
    return range -> tokensFor(document.charCount(range));
  }

  private static int tokensFor(int chars) {
    return (int) Math.ceil(chars / CHARS_PER_TOKEN);
  }
}
