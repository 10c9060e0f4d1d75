package dev.quire.chunking.boundary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Class of structural boundary a {@link BoundaryDetector} can report.
 *
 * <p>Opening kinds mark the first line of a new segment (split before the line); closing kinds
 * mark the last line of the current segment (split after the line). The default priority reflects
 * how safe a kind is to split on: unit &gt; output element &gt; repetition &gt; conditional &gt;
 * variable cluster.
 */
public enum BoundaryKind {
  UNIT_START("unit-start", true, 50),
  UNIT_END("unit-end", false, 50),
  OUTPUT_ELEMENT_OPEN("output-element-open", true, 40),
  REPETITION_START("repetition-start", true, 30),
  CONDITIONAL_BLOCK_START("conditional-block-start", true, 20),
  CONDITIONAL_BLOCK_END("conditional-block-end", false, 20),
  VARIABLE_CLUSTER_START("variable-cluster-start", true, 10);

  private final String value;
  private final boolean opensSegment;
  private final int defaultPriority;

  BoundaryKind(String value, boolean opensSegment, int defaultPriority) {
    this.value = value;
    this.opensSegment = opensSegment;
    this.defaultPriority = defaultPriority;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** True when a boundary of this kind starts a new segment at its own line. */
  public boolean opensSegment() {
    return opensSegment;
  }

  public int defaultPriority() {
    return defaultPriority;
  }

  @JsonCreator
  public static BoundaryKind fromValue(String value) {
    for (BoundaryKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Invalid boundary kind: " + value);
  }
}
