package dev.quire.chunking.boundary;

import java.util.Set;

/** Element names the detectors recognise, matched on the conventional {@code xsl:} prefix. */
final class XslNames {

  static final String PREFIX = "xsl:";

  static final Set<String> UNITS = Set.of("xsl:template", "xsl:function");
  static final Set<String> REPETITIONS =
      Set.of("xsl:for-each", "xsl:for-each-group", "xsl:iterate");
  static final Set<String> CONDITIONALS = Set.of("xsl:choose", "xsl:if");
  static final Set<String> DECLARATIONS = Set.of("xsl:variable", "xsl:param");

  private XslNames() {}

  /** True for output-constructing elements, i.e. anything outside the {@code xsl:} namespace. */
  static boolean isLiteral(String name) {
    return !name.startsWith(PREFIX);
  }
}
