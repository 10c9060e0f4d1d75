package dev.quire.chunking.boundary;

import dev.quire.document.LineRange;
import java.util.List;
import java.util.OptionalInt;

/** Result of one {@link MarkupScanner} pass: tag events plus open/close pairing. */
final class MarkupScan {

  private final LineRange range;
  private final List<TagEvent> events;
  private final int[] partners;
  private final boolean desynchronized;

  MarkupScan(LineRange range, List<TagEvent> events, int[] partners, boolean desynchronized) {
    this.range = range;
    this.events = List.copyOf(events);
    this.partners = partners;
    this.desynchronized = desynchronized;
  }

  LineRange range() {
    return range;
  }

  List<TagEvent> events() {
    return events;
  }

  /** True when a mismatched close tag was met; later events are flagged ambiguous. */
  boolean desynchronized() {
    return desynchronized;
  }

  /** Index of the event pairing with {@code event}, or -1 when it has none. */
  int partnerIndex(TagEvent event) {
    return partners[event.index()];
  }

  /**
   * Last line of the element opened by {@code event}: its own end line when self-closing, the end
   * line of the matching close otherwise. Empty when the element is not closed inside the range.
   */
  OptionalInt endLineOf(TagEvent event) {
    if (event.type() == TagEvent.Type.SELF_CLOSING) {
      return OptionalInt.of(event.endLine());
    }
    if (event.type() != TagEvent.Type.OPEN || partners[event.index()] < 0) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(events.get(partners[event.index()]).endLine());
  }

  /**
   * Depth of the top-level content of the range: 1 when the whole range is enclosed by a single
   * element (such as a template), 0 otherwise.
   */
  int baseDepth() {
    if (events.isEmpty()) {
      return 0;
    }
    TagEvent first = events.get(0);
    int close = partners[first.index()];
    if (first.type() != TagEvent.Type.OPEN || first.depth() != 0 || close < 0) {
      return 0;
    }
    for (int i = close + 1; i < events.size(); i++) {
      TagEvent event = events.get(i);
      if (event.depth() == 0 && event.isOpening()) {
        return 0;
      }
    }
    return 1;
  }
}
