package dev.quire.chunking;

import dev.quire.chunking.size.DocumentSizer;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides how many trailing lines of a sub-segment are repeated at the head of the next one.
 *
 * <p>The planned overlap comes from the {@link OverlapPolicy} and never reaches the full length of
 * the previous segment. It is then shortened line by line while the next segment, overlap
 * included, would exceed the token maximum plus the policy's tolerance.
 */
@Component
public class OverlapCalculator {

  /** Overlap the policy asks for after a segment of {@code previousLines} lines. */
  public int plannedLines(int previousLines, OverlapPolicy policy) {
    int planned =
        switch (policy.mode()) {
          case FIXED -> policy.targetLines();
          case PROPORTIONAL ->
              Math.min(policy.targetLines(), (int) Math.ceil(previousLines * policy.ratio()));
        };
    return Math.max(0, Math.min(planned, previousLines - 1));
  }

  /**
   * Overlap between two adjacent segments of one unit.
   *
   * @param previous owned lines of the earlier segment
   * @param next owned lines of the later segment, starting right after {@code previous}
   */
  public int overlapLines(
      LineRange previous,
      LineRange next,
      DocumentSizer sizer,
      int maxTokens,
      OverlapPolicy policy) {
    if (next.start() != previous.end() + 1) {
      throw new IllegalArgumentException(previous + " and " + next + " are not adjacent");
    }
    int limit = maxTokens + policy.toleranceTokens();
    int lines = plannedLines(previous.lineCount(), policy);
    while (lines > 0 && sizer.estimate(next.start() - lines, next.end()) > limit) {
      lines--;
    }
    return lines;
  }

  /** Overlap of each segment with its predecessor; the first is always 0. */
  public List<Integer> calculate(
      List<SplitSegment> segments, DocumentSizer sizer, ChunkingConfig config) {
    List<Integer> overlaps = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      if (i == 0) {
        overlaps.add(0);
        continue;
      }
      overlaps.add(
          overlapLines(
              segments.get(i - 1).range(),
              segments.get(i).range(),
              sizer,
              config.maxChunkTokens(),
              config.overlap()));
    }
    return overlaps;
  }
}
