package dev.quire.document;

/**
 * Inclusive range of 1-indexed document lines.
 *
 * @param start first line of the range
 * @param end last line of the range (inclusive)
 */
public record LineRange(int start, int end) {

  public LineRange {
    if (start < 1) {
      throw new IllegalArgumentException("start must be >= 1, got: " + start);
    }
    if (end < start) {
      throw new IllegalArgumentException(
          "end must be >= start, got: [" + start + ", " + end + "]");
    }
  }

  public int lineCount() {
    return end - start + 1;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "]";
  }
}
