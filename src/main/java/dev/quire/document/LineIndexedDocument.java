package dev.quire.document;

import java.nio.CharBuffer;
import java.util.Arrays;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable, line-addressable view over the raw text of one input document.
 *
 * <p>The text is held once as a single buffer; lines are addressed through offset arrays, so line
 * and range lookups never copy the document. Lines are 1-indexed and split on {@code \n}. Both
 * {@code \r\n} and a lone {@code \r} are normalised to {@code \n}, so no line ends with a carriage
 * return. A single trailing newline does not produce an extra empty line.
 */
public final class LineIndexedDocument {

  private static final int TAB_WIDTH = 4;

  private final String sourceId;
  private final String buffer;
  private final int[] lineStarts;
  private final int[] lineEnds;

  public LineIndexedDocument(@Nullable String text, String sourceId) {
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    if (text == null || text.isBlank()) {
      throw new DocumentException("Document '" + sourceId + "' is empty");
    }
    this.sourceId = sourceId;
    this.buffer =
        text.indexOf('\r') >= 0 ? text.replace("\r\n", "\n").replace('\r', '\n') : text;

    int capacity = 16;
    int[] starts = new int[capacity];
    int[] ends = new int[capacity];
    int count = 0;
    int lineStart = 0;
    int length = buffer.length();
    while (lineStart < length) {
      int newline = buffer.indexOf('\n', lineStart);
      int lineEnd = newline < 0 ? length : newline;
      if (count == capacity) {
        capacity *= 2;
        starts = Arrays.copyOf(starts, capacity);
        ends = Arrays.copyOf(ends, capacity);
      }
      starts[count] = lineStart;
      ends[count] = lineEnd;
      count++;
      lineStart = newline < 0 ? length : newline + 1;
    }
    this.lineStarts = Arrays.copyOf(starts, count);
    this.lineEnds = Arrays.copyOf(ends, count);
  }

  public String sourceId() {
    return sourceId;
  }

  public int lineCount() {
    return lineStarts.length;
  }

  /** Returns the range spanning every line of the document. */
  public LineRange fullRange() {
    return new LineRange(1, lineCount());
  }

  /** Returns line {@code n} as a string (copied). */
  public String line(int n) {
    checkLine(n);
    return buffer.substring(lineStarts[n - 1], lineEnds[n - 1]);
  }

  /** Returns a read-only, non-copying view of line {@code n}. */
  public CharSequence lineView(int n) {
    checkLine(n);
    return CharBuffer.wrap(buffer, lineStarts[n - 1], lineEnds[n - 1]);
  }

  /** Returns the lines of {@code range} as one contiguous block joined by {@code \n}. */
  public String text(LineRange range) {
    checkRange(range);
    return buffer.substring(lineStarts[range.start() - 1], lineEnds[range.end() - 1]);
  }

  /**
   * Number of characters in {@code range}, counting one separator between consecutive lines.
   * Computed from offsets without materialising the text.
   */
  public int charCount(LineRange range) {
    checkRange(range);
    return lineEnds[range.end() - 1] - lineStarts[range.start() - 1];
  }

  /** Leading whitespace width of line {@code n}, with tabs counted as four columns. */
  public int indentation(int n) {
    checkLine(n);
    int width = 0;
    for (int i = lineStarts[n - 1]; i < lineEnds[n - 1]; i++) {
      char c = buffer.charAt(i);
      if (c == ' ') {
        width++;
      } else if (c == '\t') {
        width += TAB_WIDTH;
      } else {
        break;
      }
    }
    return width;
  }

  public boolean isBlank(int n) {
    checkLine(n);
    for (int i = lineStarts[n - 1]; i < lineEnds[n - 1]; i++) {
      if (!Character.isWhitespace(buffer.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns true when every line of {@code range} is blank. */
  public boolean isBlank(LineRange range) {
    for (int n = range.start(); n <= range.end(); n++) {
      if (!isBlank(n)) {
        return false;
      }
    }
    return true;
  }

  private void checkLine(int n) {
    if (n < 1 || n > lineStarts.length) {
      throw new IllegalArgumentException(
          "Line " + n + " is outside document '" + sourceId + "' (1-" + lineStarts.length + ")");
    }
  }

  private void checkRange(LineRange range) {
    if (range.end() > lineStarts.length) {
      throw new IllegalArgumentException(
          "Range " + range + " is outside document '" + sourceId + "' (1-" + lineStarts.length
              + ")");
    }
  }
}
