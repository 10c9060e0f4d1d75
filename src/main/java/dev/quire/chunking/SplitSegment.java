package dev.quire.chunking;

import dev.quire.document.LineRange;

/**
 * A piece of an oversized unit as cut by {@link ChunkSplitter}, before overlap is added.
 *
 * @param range owned lines of the segment
 * @param boundaryFallback true when at least one of the segment's cuts is not a structural boundary
 * @param budgetExceeded true when the segment alone is over the token maximum
 */
public record SplitSegment(LineRange range, boolean boundaryFallback, boolean budgetExceeded) {

  SplitSegment withBoundaryFallback() {
    return new SplitSegment(range, true, budgetExceeded);
  }
}
