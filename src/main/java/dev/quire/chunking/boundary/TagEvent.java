package dev.quire.chunking.boundary;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * One tag found by {@link MarkupScanner}.
 *
 * @param index position of this event in the scan
 * @param type open, close or self-closing
 * @param name qualified tag name, e.g. {@code xsl:for-each}
 * @param line line on which the tag starts
 * @param endLine line holding the tag's closing {@code >}
 * @param depth element depth relative to the scanned range; -1 for a close of an element opened
 *     before the range
 * @param indent indentation width of {@code line}
 * @param lineStart true when only whitespace precedes the tag on {@code line}
 * @param lineEnd true when only whitespace follows the tag on {@code endLine}
 * @param ambiguous true when the scan had lost track of nesting before or at this tag
 * @param attributes raw attribute text of an opening tag; empty for closes
 */
record TagEvent(
    int index,
    Type type,
    String name,
    int line,
    int endLine,
    int depth,
    int indent,
    boolean lineStart,
    boolean lineEnd,
    boolean ambiguous,
    String attributes) {

  enum Type {
    OPEN,
    CLOSE,
    SELF_CLOSING
  }

  boolean isOpening() {
    return type != Type.CLOSE;
  }

  /** Returns the value of attribute {@code attribute}, or null when absent. */
  @Nullable String attribute(String attribute) {
    Matcher matcher =
        Pattern.compile(
                "(?:^|\\s)" + Pattern.quote(attribute) + "\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')")
            .matcher(attributes);
    if (!matcher.find()) {
      return null;
    }
    return matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
  }
}
