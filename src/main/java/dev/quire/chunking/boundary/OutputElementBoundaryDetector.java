package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Detects the opening lines of sibling literal result elements, e.g. the repeated {@code
 * <PointOfSale>} blocks a mapping template writes one after another.
 *
 * <p>Only the shallowest depth (within {@value #MAX_DEPTH_BELOW_BASE} levels of the range's base
 * depth) holding at least two literal elements is considered, and of those only the elements
 * sitting at the most common indentation. Deeper elements are inside a block already reported.
 */
@Component
public class OutputElementBoundaryDetector implements BoundaryDetector {

  static final int MAX_DEPTH_BELOW_BASE = 4;

  @Override
  public List<BoundaryCandidate> detect(LineIndexedDocument document, LineRange range) {
    MarkupScan scan = MarkupScanner.scan(document, range);
    int base = scan.baseDepth();

    Map<Integer, List<TagEvent>> byDepth = new TreeMap<>();
    for (TagEvent event : scan.events()) {
      if (event.ambiguous()) {
        break;
      }
      if (event.isOpening()
          && event.lineStart()
          && XslNames.isLiteral(event.name())
          && event.depth() >= base
          && event.depth() <= base + MAX_DEPTH_BELOW_BASE) {
        byDepth.computeIfAbsent(event.depth(), d -> new ArrayList<>()).add(event);
      }
    }

    for (List<TagEvent> siblings : byDepth.values()) {
      if (siblings.size() >= 2) {
        return candidatesAtModalIndent(siblings);
      }
    }
    return List.of();
  }

  private static List<BoundaryCandidate> candidatesAtModalIndent(List<TagEvent> siblings) {
    Map<Integer, Integer> indentCounts = new TreeMap<>();
    for (TagEvent event : siblings) {
      indentCounts.merge(event.indent(), 1, Integer::sum);
    }
    int modalIndent = -1;
    int best = 0;
    // TreeMap order makes the shallowest indentation win ties
    for (Map.Entry<Integer, Integer> entry : indentCounts.entrySet()) {
      if (entry.getValue() > best) {
        best = entry.getValue();
        modalIndent = entry.getKey();
      }
    }

    List<BoundaryCandidate> candidates = new ArrayList<>();
    for (TagEvent event : siblings) {
      if (event.indent() == modalIndent) {
        candidates.add(
            BoundaryCandidate.of(
                event.line(), BoundaryKind.OUTPUT_ELEMENT_OPEN, "<" + event.name() + ">"));
      }
    }
    return candidates;
  }
}
