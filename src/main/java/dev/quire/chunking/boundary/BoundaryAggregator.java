package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs every {@link BoundaryDetector} over a range and merges their candidates into one ordered,
 * de-duplicated list.
 *
 * <ol>
 *   <li>priorities are re-weighted from the supplied per-kind map (kinds absent from the map keep
 *       their default priority)
 *   <li>candidates are ordered by split position; ties go to the higher priority
 *   <li>only the highest-priority candidate survives at each split position
 *   <li>a candidate of the same kind as the previous survivor, on the same or the next line, is
 *       folded into it
 * </ol>
 */
@Component
public class BoundaryAggregator {

  private static final Logger log = LoggerFactory.getLogger(BoundaryAggregator.class);

  private static final Comparator<BoundaryCandidate> ORDER =
      Comparator.comparingInt(BoundaryCandidate::splitPosition)
          .thenComparing(Comparator.comparingInt(BoundaryCandidate::priority).reversed())
          .thenComparing(BoundaryCandidate::kind);

  private final List<BoundaryDetector> detectors;

  public BoundaryAggregator(List<BoundaryDetector> detectors) {
    this.detectors = List.copyOf(detectors);
  }

  /** Aggregator over the five standard detectors. */
  public static BoundaryAggregator withDefaultDetectors() {
    return new BoundaryAggregator(
        List.of(
            new UnitBoundaryDetector(),
            new OutputElementBoundaryDetector(),
            new RepetitionBoundaryDetector(),
            new ConditionalBlockBoundaryDetector(),
            new VariableClusterBoundaryDetector()));
  }

  public List<BoundaryCandidate> aggregate(
      LineIndexedDocument document, LineRange range, Map<BoundaryKind, Integer> priorities) {
    List<BoundaryCandidate> all = new ArrayList<>();
    for (BoundaryDetector detector : detectors) {
      for (BoundaryCandidate candidate : detector.detect(document, range)) {
        @Nullable Integer priority = priorities.get(candidate.kind());
        all.add(priority != null ? candidate.withPriority(priority) : candidate);
      }
    }
    all.sort(ORDER);

    List<BoundaryCandidate> merged = new ArrayList<>();
    for (BoundaryCandidate candidate : all) {
      if (!merged.isEmpty()) {
        BoundaryCandidate last = merged.get(merged.size() - 1);
        if (last.splitPosition() == candidate.splitPosition()) {
          continue;
        }
        if (last.kind() == candidate.kind() && candidate.line() - last.line() <= 1) {
          continue;
        }
      }
      merged.add(candidate);
    }
    log.debug(
        "{} in {}: {} boundary candidates, {} after merging",
        document.sourceId(), range, all.size(), merged.size());
    return List.copyOf(merged);
  }
}
