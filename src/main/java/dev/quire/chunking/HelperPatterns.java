package dev.quire.chunking;

import java.util.List;
import java.util.Locale;

/**
 * Helper-template name presets for common XSLT generators. Patterns are searched anywhere in the
 * template name.
 */
public final class HelperPatterns {

  /** Altova MapForce helpers such as {@code vmf:vmf1_inputtoresult}. */
  public static final List<String> MAPFORCE = List.of("(?:vmf:)?vmf\\d+");

  public static final List<String> SAXON = List.of("(?:f:)?func\\d+");

  public static final List<String> CUSTOM = List.of("(?:util:)?helper[\\w_]*");

  public static final List<String> GENERIC = List.of("(?:\\w+:)?(?:helper|util|fn)\\w*");

  private HelperPatterns() {}

  /** Returns the preset named {@code name}: mapforce, saxon, custom or generic. */
  public static List<String> preset(String name) {
    return switch (name.toLowerCase(Locale.ROOT)) {
      case "mapforce" -> MAPFORCE;
      case "saxon" -> SAXON;
      case "custom" -> CUSTOM;
      case "generic" -> GENERIC;
      default -> throw new IllegalArgumentException("Unknown helper pattern preset: " + name);
    };
  }
}
