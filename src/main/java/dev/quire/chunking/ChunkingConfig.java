package dev.quire.chunking;

import dev.quire.chunking.boundary.BoundaryKind;
import dev.quire.chunking.size.TokenEstimation;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of one chunking run, passed explicitly to {@link ChunkAssembler#chunk}.
 *
 * @param maxChunkTokens upper bound on a chunk's estimated tokens
 * @param minChunkTokens lower bound a split tries to respect before falling back
 * @param overlap overlap policy between sub-segments of one unit
 * @param tokenEstimation estimator used for every sizing decision
 * @param helperPatterns regular expressions naming helper templates
 * @param priorities per-kind boundary priority overrides
 */
public record ChunkingConfig(
    int maxChunkTokens,
    int minChunkTokens,
    OverlapPolicy overlap,
    TokenEstimation tokenEstimation,
    List<String> helperPatterns,
    Map<BoundaryKind, Integer> priorities) {

  public static final int DEFAULT_MAX_CHUNK_TOKENS = 15_000;
  public static final int DEFAULT_MIN_CHUNK_TOKENS = 1_000;

  public ChunkingConfig {
    Objects.requireNonNull(overlap, "overlap must not be null");
    Objects.requireNonNull(tokenEstimation, "tokenEstimation must not be null");
    if (maxChunkTokens <= 0) {
      throw new IllegalArgumentException("maxChunkTokens must be > 0, got: " + maxChunkTokens);
    }
    if (minChunkTokens < 0 || minChunkTokens > maxChunkTokens) {
      throw new IllegalArgumentException(
          "minChunkTokens must be in [0, maxChunkTokens], got: " + minChunkTokens);
    }
    helperPatterns = List.copyOf(helperPatterns);
    priorities = priorities.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(priorities));
  }

  public static ChunkingConfig defaults() {
    return of(
        DEFAULT_MAX_CHUNK_TOKENS, DEFAULT_MIN_CHUNK_TOKENS, OverlapPolicy.DEFAULT_TARGET_LINES);
  }

  /** Config with a fixed overlap policy, character-ratio estimation and MapForce helper names. */
  public static ChunkingConfig of(int maxChunkTokens, int minChunkTokens, int overlapTargetLines) {
    return new ChunkingConfig(
        maxChunkTokens,
        minChunkTokens,
        OverlapPolicy.fixed(overlapTargetLines),
        TokenEstimation.CHARACTER_RATIO,
        HelperPatterns.MAPFORCE,
        Map.of());
  }

  public ChunkingConfig withTokenEstimation(TokenEstimation newEstimation) {
    return new ChunkingConfig(
        maxChunkTokens, minChunkTokens, overlap, newEstimation, helperPatterns, priorities);
  }

  public ChunkingConfig withHelperPatterns(List<String> newPatterns) {
    return new ChunkingConfig(
        maxChunkTokens, minChunkTokens, overlap, tokenEstimation, newPatterns, priorities);
  }

  public ChunkingConfig withPriority(BoundaryKind kind, int priority) {
    Map<BoundaryKind, Integer> updated = new EnumMap<>(BoundaryKind.class);
    updated.putAll(priorities);
    updated.put(kind, priority);
    return new ChunkingConfig(
        maxChunkTokens, minChunkTokens, overlap, tokenEstimation, helperPatterns, updated);
  }
}
