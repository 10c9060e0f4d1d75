package dev.quire.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quire.chunking.boundary.BoundaryCandidate;
import dev.quire.chunking.boundary.BoundaryKind;
import dev.quire.chunking.size.CharacterRatioEstimator;
import dev.quire.chunking.size.DocumentSizer;
import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkSplitterTest {

  private final ChunkSplitter splitter = new ChunkSplitter(new OverlapCalculator());

  /** Every line is 7 characters, so any range of n lines estimates to exactly 2n tokens. */
  private static DocumentSizer twoTokensPerLine(int lines) {
    var document = new LineIndexedDocument("abcdefg\n".repeat(lines), "uniform");
    return new CharacterRatioEstimator().forDocument(document);
  }

  private static List<BoundaryCandidate> outputOpensAt(int... lines) {
    return java.util.Arrays.stream(lines)
        .mapToObj(line -> BoundaryCandidate.of(line, BoundaryKind.OUTPUT_ELEMENT_OPEN, "<R>"))
        .toList();
  }

  private static List<LineRange> ranges(List<SplitSegment> segments) {
    return segments.stream().map(SplitSegment::range).toList();
  }

  @Test
  void rangeWithinBudgetStaysWhole() {
    List<SplitSegment> segments =
        splitter.split(
            new LineRange(1, 10), List.of(), twoTokensPerLine(10), ChunkingConfig.of(100, 0, 0));

    assertThat(segments).containsExactly(new SplitSegment(new LineRange(1, 10), false, false));
  }

  @Test
  void cutsAtLastBoundaryThatFits() {
    List<SplitSegment> segments =
        splitter.split(
            new LineRange(1, 30),
            outputOpensAt(8, 15, 22),
            twoTokensPerLine(30),
            ChunkingConfig.of(20, 0, 0));

    assertThat(ranges(segments))
        .containsExactly(
            new LineRange(1, 7),
            new LineRange(8, 14),
            new LineRange(15, 21),
            new LineRange(22, 30));
    assertThat(segments).noneMatch(SplitSegment::boundaryFallback);
  }

  @Test
  void boundaryLeavingSegmentBelowMinimumFallsBackToHardSplit() {
    List<SplitSegment> segments =
        splitter.split(
            new LineRange(1, 30),
            outputOpensAt(8, 15, 22),
            twoTokensPerLine(30),
            ChunkingConfig.of(20, 16, 0));

    assertThat(ranges(segments))
        .containsExactly(new LineRange(1, 10), new LineRange(11, 20), new LineRange(21, 30));
    assertThat(segments).allMatch(SplitSegment::boundaryFallback);
  }

  @Test
  void withoutBoundariesEverySegmentIsFlaggedFallback() {
    List<SplitSegment> segments =
        splitter.split(
            new LineRange(1, 25), List.of(), twoTokensPerLine(25), ChunkingConfig.of(20, 0, 0));

    assertThat(ranges(segments))
        .containsExactly(new LineRange(1, 10), new LineRange(11, 20), new LineRange(21, 25));
    assertThat(segments).allMatch(SplitSegment::boundaryFallback);
    assertThat(segments).noneMatch(SplitSegment::budgetExceeded);
  }

  @Test
  void hardSplitFlagsOnlyTheTwoSegmentsItSeparates() {
    // 1-7 | 8-14 at boundaries, then no boundary until the end
    List<SplitSegment> segments =
        splitter.split(
            new LineRange(1, 30),
            outputOpensAt(8, 15),
            twoTokensPerLine(30),
            ChunkingConfig.of(20, 0, 0));

    assertThat(ranges(segments))
        .containsExactly(
            new LineRange(1, 7),
            new LineRange(8, 14),
            new LineRange(15, 24),
            new LineRange(25, 30));
    assertThat(segments)
        .extracting(SplitSegment::boundaryFallback)
        .containsExactly(false, false, true, true);
  }

  @Test
  void singleOversizedLineBecomesItsOwnFlaggedSegment() {
    var document = new LineIndexedDocument("short\n" + "x".repeat(400) + "\nshort", "wide");
    DocumentSizer sizer = new CharacterRatioEstimator().forDocument(document);

    List<SplitSegment> segments =
        splitter.split(document.fullRange(), List.of(), sizer, ChunkingConfig.of(20, 0, 0));

    assertThat(ranges(segments))
        .containsExactly(new LineRange(1, 1), new LineRange(2, 2), new LineRange(3, 3));
    assertThat(segments)
        .extracting(SplitSegment::budgetExceeded)
        .containsExactly(false, true, false);
  }

  @Test
  void reservesRoomForPlannedOverlap() {
    List<SplitSegment> segments =
        splitter.split(
            new LineRange(1, 30), List.of(), twoTokensPerLine(30), ChunkingConfig.of(20, 0, 3));

    // the first segment takes the full 10 lines; later ones leave 3 lines for overlap
    assertThat(ranges(segments))
        .containsExactly(
            new LineRange(1, 10),
            new LineRange(11, 17),
            new LineRange(18, 24),
            new LineRange(25, 30));
  }

  @Test
  void candidatesOutsideTheRangeAreIgnored() {
    List<SplitSegment> segments =
        splitter.split(
            new LineRange(11, 30),
            outputOpensAt(5, 11, 40),
            twoTokensPerLine(40),
            ChunkingConfig.of(20, 0, 0));

    assertThat(ranges(segments)).containsExactly(new LineRange(11, 20), new LineRange(21, 30));
    assertThat(segments).allMatch(SplitSegment::boundaryFallback);
  }

  @Test
  void segmentsCoverTheRangeWithoutGaps() {
    LineRange range = new LineRange(3, 97);
    List<SplitSegment> segments =
        splitter.split(
            range,
            outputOpensAt(9, 30, 31, 55, 80),
            twoTokensPerLine(100),
            ChunkingConfig.of(24, 4, 2));

    assertThat(segments.get(0).range().start()).isEqualTo(3);
    assertThat(segments.get(segments.size() - 1).range().end()).isEqualTo(97);
    for (int i = 1; i < segments.size(); i++) {
      assertThat(segments.get(i).range().start())
          .isEqualTo(segments.get(i - 1).range().end() + 1);
    }
  }
}
