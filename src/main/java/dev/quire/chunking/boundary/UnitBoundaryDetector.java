package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Detects top-level units: {@code xsl:template} and {@code xsl:function} elements.
 *
 * <p>Only outermost units are reported; a unit nested in another element of the same class is part
 * of its parent. Units whose close tag is missing are omitted.
 */
@Component
public class UnitBoundaryDetector implements BoundaryDetector {

  /**
   * A unit element and its extent.
   *
   * @param range lines from the open tag to the close tag, inclusive
   * @param element {@code xsl:template} or {@code xsl:function}
   * @param name the {@code name} attribute, else {@code match:<pattern>}, else empty
   */
  public record UnitSpan(LineRange range, String element, String name) {

    public boolean isFunction() {
      return "xsl:function".equals(element);
    }
  }

  @Override
  public List<BoundaryCandidate> detect(LineIndexedDocument document, LineRange range) {
    MarkupScan scan = MarkupScanner.scan(document, range);
    List<BoundaryCandidate> candidates = new ArrayList<>();
    for (TagEvent open : outermostUnits(scan)) {
      TagEvent close = scan.events().get(scan.partnerIndex(open));
      String label = labelOf(open);
      candidates.add(BoundaryCandidate.of(open.line(), BoundaryKind.UNIT_START, label));
      if (close.lineEnd()) {
        candidates.add(BoundaryCandidate.of(close.endLine(), BoundaryKind.UNIT_END, label));
      }
    }
    return candidates;
  }

  /** Returns the outermost closed units of {@code range} in document order. */
  public List<UnitSpan> findUnits(LineIndexedDocument document, LineRange range) {
    MarkupScan scan = MarkupScanner.scan(document, range);
    List<UnitSpan> units = new ArrayList<>();
    for (TagEvent open : outermostUnits(scan)) {
      int end = scan.endLineOf(open).orElseThrow();
      units.add(new UnitSpan(new LineRange(open.line(), end), open.name(), nameOf(open)));
    }
    return units;
  }

  private static List<TagEvent> outermostUnits(MarkupScan scan) {
    List<TagEvent> units = new ArrayList<>();
    int coveredUntil = -1;
    for (TagEvent event : scan.events()) {
      if (event.ambiguous()) {
        break;
      }
      if (event.type() != TagEvent.Type.OPEN
          || !XslNames.UNITS.contains(event.name())
          || !event.lineStart()
          || event.index() < coveredUntil) {
        continue;
      }
      int close = scan.partnerIndex(event);
      if (close < 0) {
        continue;
      }
      units.add(event);
      coveredUntil = close;
    }
    return units;
  }

  private static String labelOf(TagEvent open) {
    String name = nameOf(open);
    return "<" + open.name() + (name.isEmpty() ? "" : " " + name) + ">";
  }

  private static String nameOf(TagEvent event) {
    @Nullable String name = event.attribute("name");
    if (name != null) {
      return name;
    }
    @Nullable String match = event.attribute("match");
    return match != null ? "match:" + match : "";
  }
}
