package dev.quire.chunking;

import dev.quire.chunking.boundary.BoundaryCandidate;
import dev.quire.chunking.size.DocumentSizer;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts an oversized line range into segments that fit the token maximum, preferring structural
 * boundaries as cut points.
 *
 * <p>Greedy forward scan: from the current start, binary-search the last line keeping the segment
 * within the maximum (estimates are monotonic), then back up to the nearest boundary that still
 * leaves the segment at or above the minimum. Without such a boundary the segment is cut hard at
 * the last fitting line. A single line that alone exceeds the maximum becomes a segment of its own.
 *
 * <p>Every segment after the first reserves room for the overlap the {@link OverlapCalculator}
 * will plan for it; the reservation is dropped when not even one line fits alongside it.
 *
 * <p>Any cut that is not a boundary flags both segments it separates as boundary fallbacks.
 */
@Component
public class ChunkSplitter {

  private static final Logger log = LoggerFactory.getLogger(ChunkSplitter.class);

  private final OverlapCalculator overlapCalculator;

  public ChunkSplitter(OverlapCalculator overlapCalculator) {
    this.overlapCalculator = overlapCalculator;
  }

  /**
   * Splits {@code range} into consecutive segments covering it exactly.
   *
   * @param candidates aggregated boundaries of the range; only split positions inside the range
   *     are used
   */
  public List<SplitSegment> split(
      LineRange range,
      List<BoundaryCandidate> candidates,
      DocumentSizer sizer,
      ChunkingConfig config) {
    NavigableSet<Integer> positions = new TreeSet<>();
    for (BoundaryCandidate candidate : candidates) {
      int position = candidate.splitPosition();
      if (position > range.start() && position <= range.end()) {
        positions.add(position);
      }
    }

    int max = config.maxChunkTokens();
    List<SplitSegment> segments = new ArrayList<>();
    @Nullable LineRange previous = null;
    int start = range.start();
    while (start <= range.end()) {
      int windowStart = start;
      if (previous != null) {
        int reserve = overlapCalculator.plannedLines(previous.lineCount(), config.overlap());
        if (reserve > 0 && sizer.estimate(start - reserve, start) <= max) {
          windowStart = start - reserve;
        }
      }

      LineRange segment;
      boolean exceeded = false;
      if (sizer.estimate(windowStart, range.end()) <= max) {
        segment = new LineRange(start, range.end());
      } else if (sizer.estimate(start, start) > max) {
        segment = new LineRange(start, start);
        exceeded = true;
        log.warn(
            "Line {} alone is over the {}-token maximum ({} tokens); emitting it unsplit",
            start, max, sizer.estimate(start, start));
      } else {
        int limitEnd = lastFittingLine(sizer, windowStart, start, range.end() - 1, max);
        @Nullable Integer boundary = positions.floor(limitEnd + 1);
        if (boundary != null
            && boundary > start
            && sizer.estimate(start, boundary - 1) >= config.minChunkTokens()) {
          segment = new LineRange(start, boundary - 1);
        } else {
          segment = new LineRange(start, limitEnd);
          log.debug(
              "No boundary in lines {}-{} keeps the segment in [{}, {}] tokens; cut after line {}",
              start, limitEnd + 1, config.minChunkTokens(), max, limitEnd);
        }
      }
      segments.add(new SplitSegment(segment, false, exceeded));
      previous = segment;
      start = segment.end() + 1;
    }
    return markFallbacks(segments, positions);
  }

  /** Largest line in {@code [low, high]} keeping {@code windowStart..line} within {@code max}. */
  private static int lastFittingLine(
      DocumentSizer sizer, int windowStart, int low, int high, int max) {
    int fitting = low;
    int lo = low + 1;
    int hi = high;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (sizer.estimate(windowStart, mid) <= max) {
        fitting = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    return fitting;
  }

  private static List<SplitSegment> markFallbacks(
      List<SplitSegment> segments, NavigableSet<Integer> positions) {
    List<SplitSegment> marked = new ArrayList<>(segments);
    for (int i = 1; i < marked.size(); i++) {
      int cut = marked.get(i).range().start();
      if (!positions.contains(cut)) {
        marked.set(i - 1, marked.get(i - 1).withBoundaryFallback());
        marked.set(i, marked.get(i).withBoundaryFallback());
      }
    }
    return List.copyOf(marked);
  }
}
