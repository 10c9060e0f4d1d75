package dev.quire.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quire.chunking.Chunk;
import dev.quire.chunking.UnitType;
import dev.quire.chunking.size.TokenEstimation;
import dev.quire.fixture.ChunkBuilder;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenBudgetTruncatorTest {

  @Test
  void chunkWithinBudgetIsListed() {
    var truncator = new TokenBudgetTruncator(5000);
    Chunk chunk =
        new ChunkBuilder()
            .id("chunk_002")
            .unitType(UnitType.HELPER_TEMPLATE)
            .name("vmf:vmf1_inputtoresult")
            .lines(5, 19)
            .tokenEstimate(120)
            .dependencies("var:input")
            .build();

    String output = truncator.truncate(List.of(chunk));

    assertThat(output)
        .isEqualTo(
            "## chunk_002 (primary_unit, helper_template vmf:vmf1_inputtoresult)\n"
                + "Lines: 5-19 (overlap 0) | ~120 tokens | complexity 0.25\n"
                + "Dependencies: var:input\n\n");
  }

  @Test
  void flagsAndOverlapAreShown() {
    var truncator = new TokenBudgetTruncator(5000);
    Chunk chunk =
        new ChunkBuilder()
            .id("chunk_004_sub_3")
            .lines(95, 180)
            .overlap(5)
            .boundaryFallback(true)
            .budgetExceeded(true)
            .build();

    String output = truncator.truncate(List.of(chunk));

    assertThat(output).contains("## chunk_004_sub_3 (sub_segment, main_template match:/)");
    assertThat(output).contains("Lines: 95-180 (overlap 5)");
    assertThat(output).contains("[boundary-fallback] [budget-exceeded]");
    assertThat(output).contains("Dependencies: none");
  }

  @Test
  void listingStopsAtBudgetAndReportsOmittedChunks() {
    // each summary block is a little over 30 tokens
    var truncator = new TokenBudgetTruncator(70);
    List<Chunk> chunks =
        List.of(
            new ChunkBuilder().id("chunk_001").build(),
            new ChunkBuilder().id("chunk_002").build(),
            new ChunkBuilder().id("chunk_003").build());

    String output = truncator.truncate(chunks);

    assertThat(output).contains("## chunk_001").contains("## chunk_002");
    assertThat(output).doesNotContain("## chunk_003");
    assertThat(output).endsWith("\n(1 more chunks not listed: token budget reached)\n");
  }

  @Test
  void emptyListReturnsEmptyString() {
    var truncator = new TokenBudgetTruncator(5000);

    assertThat(truncator.truncate(Collections.emptyList())).isEmpty();
    assertThat(truncator.truncate(null)).isEmpty();
  }

  @Test
  void firstChunkAlwaysListedEvenIfOverBudget() {
    var truncator = new TokenBudgetTruncator(10);
    List<Chunk> chunks =
        List.of(
            new ChunkBuilder().id("chunk_001").build(), new ChunkBuilder().id("chunk_002").build());

    String output = truncator.truncate(chunks);

    assertThat(output).startsWith("## chunk_001");
    assertThat(output).contains("(1 more chunks not listed");
  }

  @Test
  void estimateUsesFourCharactersPerToken() {
    var truncator = new TokenBudgetTruncator(5000);

    assertThat(truncator.estimateTokens("abcd")).isEqualTo(1);
    assertThat(truncator.estimateTokens("abcde")).isEqualTo(2);
    assertThat(truncator.getTokenBudget()).isEqualTo(5000);
  }

  @Test
  void estimateMatchesCharacterRatioChunkSizing() {
    var truncator = new TokenBudgetTruncator(5000);
    String text = "<xsl:value-of select=\"@id\"/>\n";

    assertThat(truncator.estimateTokens(text))
        .isEqualTo(TokenEstimation.CHARACTER_RATIO.estimator().estimateText(text));
  }
}
