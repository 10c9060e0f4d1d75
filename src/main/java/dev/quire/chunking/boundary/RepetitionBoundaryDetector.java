package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Detects repetition constructs ({@code xsl:for-each}, {@code xsl:for-each-group}, {@code
 * xsl:iterate}) at the top level of a range. Loops whose end is not inside the range are skipped.
 */
@Component
public class RepetitionBoundaryDetector implements BoundaryDetector {

  @Override
  public List<BoundaryCandidate> detect(LineIndexedDocument document, LineRange range) {
    MarkupScan scan = MarkupScanner.scan(document, range);
    int base = scan.baseDepth();
    List<BoundaryCandidate> candidates = new ArrayList<>();
    for (TagEvent event : scan.events()) {
      if (event.ambiguous()) {
        break;
      }
      if (event.type() == TagEvent.Type.OPEN
          && event.lineStart()
          && event.depth() == base
          && XslNames.REPETITIONS.contains(event.name())
          && scan.endLineOf(event).isPresent()) {
        candidates.add(
            BoundaryCandidate.of(event.line(), BoundaryKind.REPETITION_START, labelOf(event)));
      }
    }
    return candidates;
  }

  private static String labelOf(TagEvent event) {
    @Nullable String select = event.attribute("select");
    return "<" + event.name() + (select != null ? " select=" + select : "") + ">";
  }
}
