package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lexical tag scanner shared by the boundary detectors.
 *
 * <p>Walks a line range once, character by character, and reports opening, closing and
 * self-closing tags with their element depth relative to the start of the range. Comments, CDATA
 * sections, processing instructions and declarations are skipped. Tags may span several lines and
 * may contain {@code >} inside quoted attribute values.
 *
 * <p>This is not a parser: nothing is validated. A close tag that does not match the innermost open
 * element means nesting can no longer be trusted, so that event and every later one is flagged
 * {@linkplain TagEvent#ambiguous() ambiguous}.
 */
final class MarkupScanner {

  private static final Logger log = LoggerFactory.getLogger(MarkupScanner.class);

  private enum State {
    TEXT,
    TAG,
    COMMENT,
    CDATA,
    PROCESSING_INSTRUCTION,
    DECLARATION
  }

  private final LineIndexedDocument document;
  private final LineRange range;
  private final List<TagEvent> events = new ArrayList<>();
  private final List<Integer> partners = new ArrayList<>();
  private final Deque<Integer> openElements = new ArrayDeque<>();
  private final StringBuilder tag = new StringBuilder();

  private State state = State.TEXT;
  private int tagLine;
  private boolean tagLineStart;
  private char quote;
  private boolean desynchronized;

  private MarkupScanner(LineIndexedDocument document, LineRange range) {
    this.document = document;
    this.range = range;
  }

  static MarkupScan scan(LineIndexedDocument document, LineRange range) {
    MarkupScanner scanner = new MarkupScanner(document, range);
    scanner.run();
    int[] pairs = scanner.partners.stream().mapToInt(Integer::intValue).toArray();
    return new MarkupScan(range, scanner.events, pairs, scanner.desynchronized);
  }

  private void run() {
    for (int n = range.start(); n <= range.end(); n++) {
      CharSequence line = document.lineView(n);
      int i = 0;
      while (i < line.length()) {
        i = advance(line, n, i);
      }
      if (state == State.TAG) {
        tag.append('\n');
      }
    }
  }

  /** Consumes input from position {@code i} of {@code line}; returns the next position. */
  private int advance(CharSequence line, int lineNumber, int i) {
    switch (state) {
      case TEXT -> {
        int lt = indexOf(line, "<", i);
        if (lt < 0) {
          return line.length();
        }
        if (startsWith(line, lt, "<!--")) {
          state = State.COMMENT;
          return lt + 4;
        }
        if (startsWith(line, lt, "<![CDATA[")) {
          state = State.CDATA;
          return lt + 9;
        }
        if (startsWith(line, lt, "<?")) {
          state = State.PROCESSING_INSTRUCTION;
          return lt + 2;
        }
        if (startsWith(line, lt, "<!")) {
          state = State.DECLARATION;
          return lt + 2;
        }
        if (lt + 1 < line.length() && isTagStart(line.charAt(lt + 1))) {
          state = State.TAG;
          tag.setLength(0);
          tag.append('<');
          tagLine = lineNumber;
          tagLineStart = onlyWhitespace(line, 0, lt);
          quote = 0;
          return lt + 1;
        }
        // a stray '<' in text is not a tag
        return lt + 1;
      }
      case TAG -> {
        return consumeTag(line, lineNumber, i);
      }
      case COMMENT -> {
        return skipPast(line, i, "-->");
      }
      case CDATA -> {
        return skipPast(line, i, "]]>");
      }
      case PROCESSING_INSTRUCTION -> {
        return skipPast(line, i, "?>");
      }
      case DECLARATION -> {
        return skipPast(line, i, ">");
      }
      default -> throw new IllegalStateException("Unknown scanner state: " + state);
    }
  }

  private int consumeTag(CharSequence line, int lineNumber, int from) {
    for (int i = from; i < line.length(); i++) {
      char c = line.charAt(i);
      tag.append(c);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '>') {
        state = State.TEXT;
        completeTag(lineNumber, onlyWhitespace(line, i + 1, line.length()));
        return i + 1;
      }
    }
    return line.length();
  }

  private int skipPast(CharSequence line, int from, String terminator) {
    int end = indexOf(line, terminator, from);
    if (end < 0) {
      return line.length();
    }
    state = State.TEXT;
    return end + terminator.length();
  }

  private void completeTag(int endLine, boolean lineEnd) {
    boolean closing = tag.charAt(1) == '/';
    int nameStart = closing ? 2 : 1;
    int nameEnd = nameStart;
    while (nameEnd < tag.length() && isNameChar(tag.charAt(nameEnd))) {
      nameEnd++;
    }
    if (nameEnd == nameStart) {
      return;
    }
    String name = tag.substring(nameStart, nameEnd);
    int indent = document.indentation(tagLine);

    if (closing) {
      closeElement(name, endLine, indent, lineEnd);
      return;
    }

    boolean selfClosing = tag.length() >= 2 && tag.charAt(tag.length() - 2) == '/';
    int attributesEnd = tag.length() - (selfClosing ? 2 : 1);
    String attributes =
        nameEnd < attributesEnd ? tag.substring(nameEnd, attributesEnd).trim() : "";
    TagEvent.Type type = selfClosing ? TagEvent.Type.SELF_CLOSING : TagEvent.Type.OPEN;
    int index =
        add(type, name, endLine, openElements.size(), indent, lineEnd, desynchronized, attributes);
    if (selfClosing) {
      partners.set(index, index);
    } else {
      openElements.push(index);
    }
  }

  private void closeElement(String name, int endLine, int indent, boolean lineEnd) {
    if (openElements.isEmpty()) {
      // closes an element opened before the scanned range
      add(TagEvent.Type.CLOSE, name, endLine, -1, indent, lineEnd, desynchronized, "");
      return;
    }
    TagEvent innermost = events.get(openElements.peek());
    if (innermost.name().equals(name)) {
      int open = openElements.pop();
      int index =
          add(TagEvent.Type.CLOSE, name, endLine, innermost.depth(), indent, lineEnd,
              desynchronized, "");
      partners.set(open, index);
      partners.set(index, open);
      return;
    }

    if (!desynchronized) {
      log.debug(
          "Ambiguous nesting in {} at line {}: </{}> does not close <{}>; later boundaries omitted",
          range, tagLine, name, innermost.name());
    }
    desynchronized = true;
    int depth = -1;
    if (openElements.stream().anyMatch(i -> events.get(i).name().equals(name))) {
      int open;
      do {
        open = openElements.pop();
      } while (!events.get(open).name().equals(name));
      depth = events.get(open).depth();
    }
    add(TagEvent.Type.CLOSE, name, endLine, depth, indent, lineEnd, true, "");
  }

  private int add(
      TagEvent.Type type,
      String name,
      int endLine,
      int depth,
      int indent,
      boolean lineEnd,
      boolean ambiguous,
      String attributes) {
    int index = events.size();
    events.add(
        new TagEvent(
            index, type, name, tagLine, endLine, depth, indent, tagLineStart, lineEnd, ambiguous,
            attributes));
    partners.add(-1);
    return index;
  }

  private static boolean isTagStart(char c) {
    return c == '/' || Character.isLetter(c) || c == '_';
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == ':' || c == '_' || c == '-' || c == '.';
  }

  private static boolean onlyWhitespace(CharSequence line, int from, int to) {
    for (int i = from; i < to; i++) {
      if (!Character.isWhitespace(line.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean startsWith(CharSequence line, int at, String prefix) {
    if (at + prefix.length() > line.length()) {
      return false;
    }
    for (int i = 0; i < prefix.length(); i++) {
      if (line.charAt(at + i) != prefix.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  private static int indexOf(CharSequence line, String needle, int from) {
    int last = line.length() - needle.length();
    for (int i = from; i <= last; i++) {
      if (startsWith(line, i, needle)) {
        return i;
      }
    }
    return -1;
  }
}
