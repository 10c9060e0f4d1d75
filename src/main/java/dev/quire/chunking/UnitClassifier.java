package dev.quire.chunking;

import dev.quire.chunking.boundary.UnitBoundaryDetector.UnitSpan;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/** Assigns a {@link UnitType} and a display name to top-level units. */
@Component
public class UnitClassifier {

  private static final Pattern IMPORT =
      Pattern.compile("<xsl:(?:import|include)\\s+href=\"([^\"]+)\"");
  private static final Pattern DECLARATION =
      Pattern.compile("<xsl:(?:variable|param)\\s+name=\"([^\"]+)\"");
  private static final Pattern NAMESPACE = Pattern.compile("xmlns:\\w+=");

  private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

  /** Classifies a template or function found by the unit detector. */
  public StructuralUnit classify(UnitSpan span, List<String> helperPatterns) {
    @Nullable String name = span.name().isEmpty() ? null : span.name();
    if (span.isFunction()) {
      return new StructuralUnit(span.range(), UnitType.FUNCTION, name);
    }
    UnitType type =
        name != null && !name.startsWith("match:") && isHelper(name, helperPatterns)
            ? UnitType.HELPER_TEMPLATE
            : UnitType.MAIN_TEMPLATE;
    return new StructuralUnit(span.range(), type, name);
  }

  /** Classifies the text found between templates and functions. */
  public UnitType classifySection(String text) {
    if (IMPORT.matcher(text).find()) {
      return UnitType.IMPORT_SECTION;
    }
    if (DECLARATION.matcher(text).find()) {
      return UnitType.VARIABLE_SECTION;
    }
    if (NAMESPACE.matcher(text).find()) {
      return UnitType.NAMESPACE_SECTION;
    }
    return UnitType.UNKNOWN;
  }

  /** Name of a section: the first imported href or declared variable, when there is one. */
  public @Nullable String sectionName(UnitType type, String text) {
    Matcher matcher =
        switch (type) {
          case IMPORT_SECTION -> IMPORT.matcher(text);
          case VARIABLE_SECTION -> DECLARATION.matcher(text);
          default -> null;
        };
    return matcher != null && matcher.find() ? matcher.group(1) : null;
  }

  boolean isHelper(String name, List<String> helperPatterns) {
    for (String pattern : helperPatterns) {
      if (compiled.computeIfAbsent(pattern, Pattern::compile).matcher(name).find()) {
        return true;
      }
    }
    return false;
  }
}
