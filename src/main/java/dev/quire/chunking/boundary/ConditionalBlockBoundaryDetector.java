package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Detects outermost conditional blocks ({@code xsl:choose}, {@code xsl:if}).
 *
 * <p>Reports the open tag as {@link BoundaryKind#CONDITIONAL_BLOCK_START} and the matching close as
 * {@link BoundaryKind#CONDITIONAL_BLOCK_END}. Conditionals nested in another conditional are never
 * reported. An outermost conditional left open ends the scan, since every later tag sits inside it.
 */
@Component
public class ConditionalBlockBoundaryDetector implements BoundaryDetector {

  @Override
  public List<BoundaryCandidate> detect(LineIndexedDocument document, LineRange range) {
    MarkupScan scan = MarkupScanner.scan(document, range);
    List<BoundaryCandidate> candidates = new ArrayList<>();
    int insideUntil = -1;
    for (TagEvent event : scan.events()) {
      if (event.ambiguous()) {
        break;
      }
      if (event.type() != TagEvent.Type.OPEN
          || !XslNames.CONDITIONALS.contains(event.name())
          || event.index() < insideUntil) {
        continue;
      }
      int closeIndex = scan.partnerIndex(event);
      if (closeIndex < 0) {
        break;
      }
      TagEvent close = scan.events().get(closeIndex);
      insideUntil = closeIndex;

      String label = "<" + event.name() + ">";
      if (event.lineStart()) {
        candidates.add(
            BoundaryCandidate.of(event.line(), BoundaryKind.CONDITIONAL_BLOCK_START, label));
      }
      if (close.lineEnd()) {
        candidates.add(
            BoundaryCandidate.of(
                close.endLine(), BoundaryKind.CONDITIONAL_BLOCK_END, "</" + event.name() + ">"));
      }
    }
    return candidates;
  }
}
