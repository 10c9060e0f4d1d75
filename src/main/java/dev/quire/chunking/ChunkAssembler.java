package dev.quire.chunking;

import dev.quire.chunking.boundary.BoundaryAggregator;
import dev.quire.chunking.boundary.BoundaryCandidate;
import dev.quire.chunking.boundary.UnitBoundaryDetector;
import dev.quire.chunking.profile.ChunkProfiler;
import dev.quire.chunking.size.DocumentSizer;
import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Entry point of the chunking engine: turns a document into an ordered list of {@link Chunk}s.
 *
 * <p>A document whose whole estimate is within the token maximum becomes a single {@link
 * ChunkKind#PRIMARY_UNIT} chunk covering every line, typed {@link UnitType#STYLESHEET} unless the
 * document holds exactly one unit. A larger document is cut into top-level units by the {@link
 * UnitLocator}. A unit within the
 * token maximum becomes one {@link ChunkKind#PRIMARY_UNIT} chunk. A larger unit is split at its
 * aggregated structural boundaries by the {@link ChunkSplitter} and emitted as {@link
 * ChunkKind#SUB_SEGMENT} chunks linked to the unit through {@code parentUnitId}, each repeating a
 * few lines of its predecessor as decided by the {@link OverlapCalculator}.
 *
 * <p>Size problems never raise: a unit that cannot be brought under the maximum is still emitted,
 * flagged budget-exceeded. The output is deterministic for a given document and config.
 */
@Component
public class ChunkAssembler {

  private static final Logger log = LoggerFactory.getLogger(ChunkAssembler.class);

  private final UnitLocator unitLocator;
  private final BoundaryAggregator aggregator;
  private final ChunkSplitter splitter;
  private final OverlapCalculator overlapCalculator;
  private final ChunkProfiler profiler;

  /** Assembler wired with the standard detectors, for use outside a Spring context. */
  public ChunkAssembler() {
    this(
        new UnitLocator(new UnitBoundaryDetector(), new UnitClassifier()),
        BoundaryAggregator.withDefaultDetectors(),
        new ChunkSplitter(new OverlapCalculator()),
        new OverlapCalculator(),
        new ChunkProfiler());
  }

  @Autowired
  public ChunkAssembler(
      UnitLocator unitLocator,
      BoundaryAggregator aggregator,
      ChunkSplitter splitter,
      OverlapCalculator overlapCalculator,
      ChunkProfiler profiler) {
    this.unitLocator = unitLocator;
    this.aggregator = aggregator;
    this.splitter = splitter;
    this.overlapCalculator = overlapCalculator;
    this.profiler = profiler;
  }

  /**
   * Chunks raw text.
   *
   * @throws dev.quire.document.DocumentException if {@code text} is null, empty or blank
   */
  public List<Chunk> chunk(@Nullable String text, String sourceId, ChunkingConfig config) {
    return chunk(new LineIndexedDocument(text, sourceId), config);
  }

  public List<Chunk> chunk(LineIndexedDocument document, ChunkingConfig config) {
    DocumentSizer sizer = config.tokenEstimation().estimator().forDocument(document);
    List<StructuralUnit> units = unitLocator.locate(document, config.helperPatterns());
    int documentTokens = sizer.estimate(document.fullRange());
    if (documentTokens <= config.maxChunkTokens()) {
      StructuralUnit whole =
          units.size() == 1
              ? units.get(0)
              : new StructuralUnit(document.fullRange(), UnitType.STYLESHEET, null);
      log.info(
          "Chunked {}: {} lines, {} tokens within max {}, emitted as one chunk",
          document.sourceId(),
          document.lineCount(),
          documentTokens,
          config.maxChunkTokens());
      return List.of(primary(document, whole, "chunk_001", 0, documentTokens, false, false));
    }

    List<Chunk> chunks = new ArrayList<>();

    for (int u = 0; u < units.size(); u++) {
      StructuralUnit unit = units.get(u);
      String unitId = String.format("chunk_%03d", u + 1);
      int tokens = sizer.estimate(unit.range());
      if (tokens <= config.maxChunkTokens()) {
        chunks.add(primary(document, unit, unitId, chunks.size(), tokens, false, false));
        continue;
      }

      List<BoundaryCandidate> candidates =
          aggregator.aggregate(document, unit.range(), config.priorities());
      List<SplitSegment> segments = splitter.split(unit.range(), candidates, sizer, config);
      if (segments.size() == 1) {
        SplitSegment only = segments.get(0);
        chunks.add(
            primary(
                document,
                unit,
                unitId,
                chunks.size(),
                tokens,
                only.boundaryFallback(),
                only.budgetExceeded()));
        continue;
      }

      List<Integer> overlaps = overlapCalculator.calculate(segments, sizer, config);
      for (int i = 0; i < segments.size(); i++) {
        SplitSegment segment = segments.get(i);
        int overlap = overlaps.get(i);
        LineRange lines = new LineRange(segment.range().start() - overlap, segment.range().end());
        chunks.add(
            build(
                document,
                unit,
                unitId + "_sub_" + (i + 1),
                unitId,
                ChunkKind.SUB_SEGMENT,
                lines,
                overlap,
                chunks.size(),
                i,
                sizer.estimate(lines),
                segment.boundaryFallback(),
                segment.budgetExceeded()));
      }
      log.debug(
          "{}: unit {} ({} tokens, lines {}) split into {} sub-segments",
          document.sourceId(), unitId, tokens, unit.range(), segments.size());
    }

    log.info(
        "Chunked {}: {} lines, {} units, {} chunks (max {} tokens)",
        document.sourceId(),
        document.lineCount(),
        units.size(),
        chunks.size(),
        config.maxChunkTokens());
    return List.copyOf(chunks);
  }

  private Chunk primary(
      LineIndexedDocument document,
      StructuralUnit unit,
      String unitId,
      int sequenceIndex,
      int tokens,
      boolean boundaryFallback,
      boolean budgetExceeded) {
    return build(
        document,
        unit,
        unitId,
        unitId,
        ChunkKind.PRIMARY_UNIT,
        unit.range(),
        0,
        sequenceIndex,
        0,
        tokens,
        boundaryFallback,
        budgetExceeded);
  }

  private Chunk build(
      LineIndexedDocument document,
      StructuralUnit unit,
      String id,
      String parentUnitId,
      ChunkKind kind,
      LineRange lines,
      int overlap,
      int sequenceIndex,
      int partIndex,
      int tokens,
      boolean boundaryFallback,
      boolean budgetExceeded) {
    String text = document.text(lines);
    return new Chunk(
        id,
        kind,
        unit.type(),
        unit.name(),
        lines.start(),
        lines.end(),
        tokens,
        overlap,
        parentUnitId,
        sequenceIndex,
        partIndex,
        boundaryFallback,
        budgetExceeded,
        text,
        profiler.profile(text));
  }
}
