package dev.quire.chunking.size;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Selects the {@link SizeEstimator} used for every sizing decision of a chunking run. */
public enum TokenEstimation {
  CHARACTER_RATIO("character-ratio", new CharacterRatioEstimator()),
  MARKUP_AWARE("markup-aware", new MarkupAwareEstimator());

  private final String value;
  private final SizeEstimator estimator;

  TokenEstimation(String value, SizeEstimator estimator) {
    this.value = value;
    this.estimator = estimator;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public SizeEstimator estimator() {
    return estimator;
  }

  @JsonCreator
  public static TokenEstimation fromValue(String value) {
    for (TokenEstimation estimation : values()) {
      if (estimation.value.equalsIgnoreCase(value) || estimation.name().equalsIgnoreCase(value)) {
        return estimation;
      }
    }
    throw new IllegalArgumentException("Invalid token estimation: " + value);
  }
}
