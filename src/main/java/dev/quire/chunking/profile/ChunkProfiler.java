package dev.quire.chunking.profile;

import dev.quire.chunking.size.MarkupAwareEstimator;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives a {@link ChunkProfile} from chunk text with regular expressions.
 *
 * <p>Complexity is {@code (1 + 0.5 * choose + 0.2 * variables + 0.1 * xpath) * chars / 1000},
 * capped at {@value #MAX_COMPLEXITY}.
 */
@Component
public class ChunkProfiler {

  public static final double MAX_COMPLEXITY = 10.0;

  private static final Pattern VARIABLE_REFERENCE = Pattern.compile("\\$(\\w+)");
  private static final Pattern TEMPLATE_CALL =
      Pattern.compile("call-template\\s+name=\"([^\"]+)\"");
  private static final Pattern FUNCTION_CALL = Pattern.compile("(\\w+:\\w+)\\s*\\(");
  private static final Pattern CHOOSE = Pattern.compile("<xsl:choose>");
  private static final Pattern VARIABLE_DECLARATION = Pattern.compile("<xsl:variable\\s+name=");

  public ChunkProfile profile(String text) {
    int chooseCount = count(CHOOSE, text);
    int variableCount = count(VARIABLE_DECLARATION, text);
    int xpathCount = count(MarkupAwareEstimator.XPATH_EXPRESSION, text);
    return new ChunkProfile(
        dependencies(text),
        chooseCount > 0,
        variableCount > 0,
        xpathCount > 0,
        complexity(text.length(), chooseCount, variableCount, xpathCount));
  }

  static List<String> dependencies(String text) {
    TreeSet<String> dependencies = new TreeSet<>();
    collect(VARIABLE_REFERENCE, text, "var:", dependencies);
    collect(TEMPLATE_CALL, text, "template:", dependencies);
    collect(FUNCTION_CALL, text, "function:", dependencies);
    return List.copyOf(dependencies);
  }

  static double complexity(int chars, int chooseCount, int variableCount, int xpathCount) {
    double score = 1.0 + chooseCount * 0.5 + variableCount * 0.2 + xpathCount * 0.1;
    score *= chars / 1000.0;
    return Math.min(score, MAX_COMPLEXITY);
  }

  private static void collect(
      Pattern pattern, String text, String prefix, TreeSet<String> dependencies) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      dependencies.add(prefix + matcher.group(1));
    }
  }

  private static int count(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
