package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.List;

/**
 * Finds one class of structural boundary in a line range using lexical cues only.
 *
 * <p>Detectors are pure and independent of each other. A construct that cannot be classified with
 * confidence (ambiguous nesting, malformed markup) is omitted: a missed boundary is acceptable, a
 * bad split point is not. Implementations are lexical today; a streaming parser could replace one
 * without touching the splitter.
 */
public interface BoundaryDetector {

  /**
   * Returns the candidates of this detector's kind found in {@code range}, in ascending line order.
   */
  List<BoundaryCandidate> detect(LineIndexedDocument document, LineRange range);
}
