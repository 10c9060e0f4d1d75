package dev.quire.chunking.boundary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BoundaryCandidateTest {

  @Test
  void openingKindsSplitBeforeTheirLine() {
    assertThat(BoundaryCandidate.of(12, BoundaryKind.REPETITION_START, "loop").splitPosition())
        .isEqualTo(12);
  }

  @Test
  void closingKindsSplitAfterTheirLine() {
    assertThat(BoundaryCandidate.of(12, BoundaryKind.UNIT_END, "end").splitPosition())
        .isEqualTo(13);
  }

  @Test
  void defaultPrioritiesRankUnitsHighestAndVariablesLowest() {
    assertThat(BoundaryKind.UNIT_START.defaultPriority())
        .isGreaterThan(BoundaryKind.OUTPUT_ELEMENT_OPEN.defaultPriority());
    assertThat(BoundaryKind.OUTPUT_ELEMENT_OPEN.defaultPriority())
        .isGreaterThan(BoundaryKind.REPETITION_START.defaultPriority());
    assertThat(BoundaryKind.REPETITION_START.defaultPriority())
        .isGreaterThan(BoundaryKind.CONDITIONAL_BLOCK_START.defaultPriority());
    assertThat(BoundaryKind.CONDITIONAL_BLOCK_START.defaultPriority())
        .isGreaterThan(BoundaryKind.VARIABLE_CLUSTER_START.defaultPriority());
  }

  @Test
  void rejectsLineZero() {
    assertThatThrownBy(() -> BoundaryCandidate.of(0, BoundaryKind.UNIT_START, "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void kindParsesFromWireValue() {
    assertThat(BoundaryKind.fromValue("output-element-open"))
        .isEqualTo(BoundaryKind.OUTPUT_ELEMENT_OPEN);
    assertThatThrownBy(() -> BoundaryKind.fromValue("paragraph"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
