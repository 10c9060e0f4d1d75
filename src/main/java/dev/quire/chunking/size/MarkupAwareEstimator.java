package dev.quire.chunking.size;

import dev.quire.document.LineIndexedDocument;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token estimation that accounts for markup density.
 *
 * <p>Each line costs the average of a character estimate (chars / 4) and a word estimate (words /
 * 0.75), plus 0.5 per tag and 0.3 per XPath-like expression, since tags and paths split into more
 * tokens than prose. Range estimates are sums of per-line costs taken from a prefix-sum table.
 */
public final class MarkupAwareEstimator implements SizeEstimator {

  private static final double CHARS_PER_TOKEN = 4.0;
  private static final double WORDS_PER_TOKEN = 0.75;
  private static final double TAG_WEIGHT = 0.5;
  private static final double XPATH_WEIGHT = 0.3;

  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  /** Path steps, attribute references and path-bearing {@code select} attributes. */
  public static final Pattern XPATH_EXPRESSION =
      Pattern.compile("(//|@\\w+|\\.\\./|\\./)[\\w\\[\\]/.():@-]*|@\\w+|select=\"[^\"]*[/@]");
  private static final Pattern WORD = Pattern.compile("\\S+");

  @Override
  public int estimateText(CharSequence text) {
    double total = 0;
    for (String line : text.toString().split("\n", -1)) {
      total += lineCost(line);
    }
    return (int) Math.ceil(total);
  }

  @Override
  public DocumentSizer forDocument(LineIndexedDocument document) {
    double[] prefix = new double[document.lineCount() + 1];
    for (int n = 1; n <= document.lineCount(); n++) {
      prefix[n] = prefix[n - 1] + lineCost(document.lineView(n));
    }
    return range -> (int) Math.ceil(prefix[range.end()] - prefix[range.start() - 1]);
  }

  static double lineCost(CharSequence line) {
    if (line.length() == 0) {
      return 0;
    }
    double byChars = line.length() / CHARS_PER_TOKEN;
    double byWords = count(WORD, line) / WORDS_PER_TOKEN;
    return (byChars + byWords) / 2
        + count(TAG, line) * TAG_WEIGHT
        + count(XPATH_EXPRESSION, line) * XPATH_WEIGHT;
  }

  private static int count(Pattern pattern, CharSequence line) {
    Matcher matcher = pattern.matcher(line);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
