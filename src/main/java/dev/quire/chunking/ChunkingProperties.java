package dev.quire.chunking;

import dev.quire.chunking.size.TokenEstimation;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised defaults for chunking runs.
 *
 * <p>Properties are bound from {@code quire.chunking.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-chunk-tokens} - token ceiling per chunk (default 15000)
 *   <li>{@code min-chunk-tokens} - smallest segment a split aims for (default 1000)
 *   <li>{@code overlap-mode} - {@code fixed} or {@code proportional} (default fixed)
 *   <li>{@code overlap-target-lines} - planned overlap between sub-segments (default 5)
 *   <li>{@code overlap-ratio} - share of the previous segment for proportional overlap (default
 *       0.05)
 *   <li>{@code overlap-tolerance-tokens} - slack over the ceiling for overlapped chunks (default 0)
 *   <li>{@code token-estimation} - {@code character-ratio} or {@code markup-aware}
 *   <li>{@code helper-patterns} - regular expressions naming helper templates (default MapForce);
 *       an entry {@code preset:<name>} expands to one of the {@link HelperPatterns} presets
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "quire.chunking")
public class ChunkingProperties {

  private int maxChunkTokens = ChunkingConfig.DEFAULT_MAX_CHUNK_TOKENS;
  private int minChunkTokens = ChunkingConfig.DEFAULT_MIN_CHUNK_TOKENS;
  private OverlapPolicy.Mode overlapMode = OverlapPolicy.Mode.FIXED;
  private int overlapTargetLines = OverlapPolicy.DEFAULT_TARGET_LINES;
  private double overlapRatio = OverlapPolicy.DEFAULT_RATIO;
  private int overlapToleranceTokens = 0;
  private TokenEstimation tokenEstimation = TokenEstimation.CHARACTER_RATIO;
  private List<String> helperPatterns = new ArrayList<>(HelperPatterns.MAPFORCE);

  private static final String PRESET_PREFIX = "preset:";

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxChunkTokens <= 0) {
      throw new IllegalStateException(
          "quire.chunking.max-chunk-tokens must be > 0, got: " + maxChunkTokens);
    }
    if (minChunkTokens < 0 || minChunkTokens > maxChunkTokens) {
      throw new IllegalStateException(
          "quire.chunking.min-chunk-tokens must be in [0, max-chunk-tokens], got: "
              + minChunkTokens);
    }
    if (overlapTargetLines < 0) {
      throw new IllegalStateException(
          "quire.chunking.overlap-target-lines must be >= 0, got: " + overlapTargetLines);
    }
    if (overlapRatio < 0.0 || overlapRatio > 1.0) {
      throw new IllegalStateException(
          "quire.chunking.overlap-ratio must be in [0.0, 1.0], got: " + overlapRatio);
    }
    if (overlapToleranceTokens < 0) {
      throw new IllegalStateException(
          "quire.chunking.overlap-tolerance-tokens must be >= 0, got: " + overlapToleranceTokens);
    }
    for (String pattern : resolvedHelperPatterns()) {
      try {
        Pattern.compile(pattern);
      } catch (PatternSyntaxException e) {
        throw new IllegalStateException(
            "quire.chunking.helper-patterns contains an invalid regex: " + pattern, e);
      }
    }
  }

  /** Config built from these defaults. */
  public ChunkingConfig toConfig() {
    return toConfig(null, null, null);
  }

  /** Config built from these defaults, with per-request overrides where given. */
  public ChunkingConfig toConfig(
      @Nullable Integer maxOverride,
      @Nullable Integer minOverride,
      @Nullable Integer overlapLinesOverride) {
    int max = maxOverride != null ? maxOverride : maxChunkTokens;
    int min = minOverride != null ? minOverride : Math.min(minChunkTokens, max);
    int overlapLines = overlapLinesOverride != null ? overlapLinesOverride : overlapTargetLines;
    OverlapPolicy overlap =
        new OverlapPolicy(overlapMode, overlapLines, overlapRatio, overlapToleranceTokens);
    return new ChunkingConfig(
        max, min, overlap, tokenEstimation, resolvedHelperPatterns(), Map.of());
  }

  /** Helper patterns with every {@code preset:<name>} entry replaced by that preset's regexes. */
  List<String> resolvedHelperPatterns() {
    List<String> resolved = new ArrayList<>();
    for (String entry : helperPatterns) {
      if (!entry.startsWith(PRESET_PREFIX)) {
        resolved.add(entry);
        continue;
      }
      try {
        resolved.addAll(HelperPatterns.preset(entry.substring(PRESET_PREFIX.length())));
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException(
            "quire.chunking.helper-patterns names an unknown preset: " + entry, e);
      }
    }
    return resolved;
  }

  public int getMaxChunkTokens() {
    return maxChunkTokens;
  }

  public void setMaxChunkTokens(int maxChunkTokens) {
    this.maxChunkTokens = maxChunkTokens;
  }

  public int getMinChunkTokens() {
    return minChunkTokens;
  }

  public void setMinChunkTokens(int minChunkTokens) {
    this.minChunkTokens = minChunkTokens;
  }

  public OverlapPolicy.Mode getOverlapMode() {
    return overlapMode;
  }

  public void setOverlapMode(OverlapPolicy.Mode overlapMode) {
    this.overlapMode = overlapMode;
  }

  public int getOverlapTargetLines() {
    return overlapTargetLines;
  }

  public void setOverlapTargetLines(int overlapTargetLines) {
    this.overlapTargetLines = overlapTargetLines;
  }

  public double getOverlapRatio() {
    return overlapRatio;
  }

  public void setOverlapRatio(double overlapRatio) {
    this.overlapRatio = overlapRatio;
  }

  public int getOverlapToleranceTokens() {
    return overlapToleranceTokens;
  }

  public void setOverlapToleranceTokens(int overlapToleranceTokens) {
    this.overlapToleranceTokens = overlapToleranceTokens;
  }

  public TokenEstimation getTokenEstimation() {
    return tokenEstimation;
  }

  public void setTokenEstimation(TokenEstimation tokenEstimation) {
    this.tokenEstimation = tokenEstimation;
  }

  public List<String> getHelperPatterns() {
    return helperPatterns;
  }

  public void setHelperPatterns(List<String> helperPatterns) {
    this.helperPatterns = helperPatterns;
  }
}
