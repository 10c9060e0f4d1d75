package dev.quire.chunking.boundary;

import java.util.Objects;

/**
 * A line judged structurally safe to split on.
 *
 * @param line 1-indexed line carrying the structural cue
 * @param kind boundary class, which decides on which side of {@code line} the split falls
 * @param priority tie-break weight; higher wins when candidates share a split position
 * @param label human-readable description, e.g. {@code "<PointOfSale>"}
 */
public record BoundaryCandidate(int line, BoundaryKind kind, int priority, String label) {

  public BoundaryCandidate {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(label, "label must not be null");
    if (line < 1) {
      throw new IllegalArgumentException("line must be >= 1, got: " + line);
    }
  }

  /** Creates a candidate carrying the default priority of its kind. */
  public static BoundaryCandidate of(int line, BoundaryKind kind, String label) {
    return new BoundaryCandidate(line, kind, kind.defaultPriority(), label);
  }

  /** First line of the segment that would follow a split at this candidate. */
  public int splitPosition() {
    return kind.opensSegment() ? line : line + 1;
  }

  public BoundaryCandidate withPriority(int newPriority) {
    return new BoundaryCandidate(line, kind, newPriority, label);
  }
}
