package dev.quire.chunking.size;

import dev.quire.document.LineRange;

/**
 * Token estimate for line ranges of one document, produced by {@link
 * SizeEstimator#forDocument}.
 *
 * <p>Implementations are monotonic: for a fixed start line, extending the end line never lowers
 * the estimate.
 */
@FunctionalInterface
public interface DocumentSizer {

  int estimate(LineRange range);

  default int estimate(int startLine, int endLine) {
    return estimate(new LineRange(startLine, endLine));
  }
}
