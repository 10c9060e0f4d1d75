package dev.quire.mcp;

import dev.quire.chunking.Chunk;
import dev.quire.chunking.size.SizeEstimator;
import dev.quire.chunking.size.TokenEstimation;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders a chunk listing that fits within a configurable token budget.
 *
 * <p>Uses the same character-based estimate (chars / 4) as the default chunk sizing. Each chunk is
 * rendered as a short summary block (id, unit, lines, size, flags, dependencies) without its text;
 * blocks are accumulated until the budget is reached and the number of omitted chunks is reported.
 *
 * <p>If even the first block exceeds the budget, it is included but cut at the character level so
 * that at least one chunk is always listed.
 */
@Component
public class TokenBudgetTruncator {

  private static final int CHARS_PER_TOKEN = 4;

  private final SizeEstimator estimator = TokenEstimation.CHARACTER_RATIO.estimator();

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${quire.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats as many chunk summaries as fit within the configured token budget.
   *
   * @param chunks chunks in sequence order
   * @return the listing, or an empty string when there is nothing to list
   */
  public String truncate(@Nullable List<Chunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;
    int listed = 0;

    for (int i = 0; i < chunks.size(); i++) {
      String formatted = formatChunk(chunks.get(i));
      int chunkTokens = estimateTokens(formatted);

      if (i == 0 && chunkTokens > tokenBudget) {
        int maxChars = tokenBudget * CHARS_PER_TOKEN;
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        listed = 1;
        break;
      }

      if (estimatedTokens + chunkTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += chunkTokens;
      listed++;
    }

    if (listed < chunks.size()) {
      output
          .append("\n(")
          .append(chunks.size() - listed)
          .append(" more chunks not listed: token budget reached)\n");
    }
    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return estimator.estimateText(text);
  }

  private String formatChunk(Chunk chunk) {
    StringBuilder flags = new StringBuilder();
    if (chunk.boundaryFallback()) {
      flags.append(" [boundary-fallback]");
    }
    if (chunk.budgetExceeded()) {
      flags.append(" [budget-exceeded]");
    }
    String dependencies =
        chunk.profile().dependencies().isEmpty()
            ? "none"
            : String.join(", ", chunk.profile().dependencies());
    return String.format(
        Locale.ROOT,
        "## %s (%s, %s%s)\nLines: %d-%d (overlap %d) | ~%d tokens | complexity %.2f%s\n"
            + "Dependencies: %s\n\n",
        chunk.id(),
        chunk.kind().value(),
        chunk.unitType().value(),
        chunk.name() != null ? " " + chunk.name() : "",
        chunk.startLine(),
        chunk.endLine(),
        chunk.overlapWithPrevious(),
        chunk.tokenEstimate(),
        chunk.profile().complexityScore(),
        flags,
        dependencies);
  }
}
