package dev.quire.chunking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * How many lines of context a sub-segment repeats from its predecessor.
 *
 * @param mode {@link Mode#FIXED} plans {@code targetLines}; {@link Mode#PROPORTIONAL} plans {@code
 *     ceil(previousLines * ratio)} capped at {@code targetLines}
 * @param targetLines planned overlap, in lines
 * @param ratio share of the previous segment used by {@link Mode#PROPORTIONAL}
 * @param toleranceTokens how far a segment with overlap may exceed the token maximum
 */
public record OverlapPolicy(Mode mode, int targetLines, double ratio, int toleranceTokens) {

  public static final int DEFAULT_TARGET_LINES = 5;
  public static final double DEFAULT_RATIO = 0.05;

  public enum Mode {
    FIXED("fixed"),
    PROPORTIONAL("proportional");

    private final String value;

    Mode(String value) {
      this.value = value;
    }

    @JsonValue
    public String value() {
      return value;
    }

    @JsonCreator
    public static Mode fromValue(String value) {
      for (Mode mode : values()) {
        if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
          return mode;
        }
      }
      throw new IllegalArgumentException("Invalid overlap mode: " + value);
    }
  }

  public OverlapPolicy {
    Objects.requireNonNull(mode, "mode must not be null");
    if (targetLines < 0) {
      throw new IllegalArgumentException("overlap target lines must be >= 0, got: " + targetLines);
    }
    if (ratio < 0.0 || ratio > 1.0) {
      throw new IllegalArgumentException("overlap ratio must be in [0.0, 1.0], got: " + ratio);
    }
    if (toleranceTokens < 0) {
      throw new IllegalArgumentException(
          "overlap tolerance must be >= 0, got: " + toleranceTokens);
    }
  }

  public static OverlapPolicy fixed(int targetLines) {
    return new OverlapPolicy(Mode.FIXED, targetLines, DEFAULT_RATIO, 0);
  }

  public static OverlapPolicy proportional(double ratio, int maxLines) {
    return new OverlapPolicy(Mode.PROPORTIONAL, maxLines, ratio, 0);
  }

  public static OverlapPolicy none() {
    return fixed(0);
  }

  public OverlapPolicy withToleranceTokens(int tolerance) {
    return new OverlapPolicy(mode, targetLines, ratio, tolerance);
  }
}
