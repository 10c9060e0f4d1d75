package dev.quire.chunking.size;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TokenEstimationTest {

  @Test
  void parsesWireValuesAndConstantNames() {
    assertThat(TokenEstimation.fromValue("character-ratio"))
        .isEqualTo(TokenEstimation.CHARACTER_RATIO);
    assertThat(TokenEstimation.fromValue("MARKUP_AWARE")).isEqualTo(TokenEstimation.MARKUP_AWARE);
  }

  @Test
  void rejectsUnknownValue() {
    assertThatThrownBy(() -> TokenEstimation.fromValue("tiktoken"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("tiktoken");
  }

  @Test
  void eachModeProvidesItsEstimator() {
    assertThat(TokenEstimation.CHARACTER_RATIO.estimator())
        .isInstanceOf(CharacterRatioEstimator.class);
    assertThat(TokenEstimation.MARKUP_AWARE.estimator()).isInstanceOf(MarkupAwareEstimator.class);
  }
}
