package dev.quire.chunking.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Content summary of one chunk, used by consumers to decide what a chunk needs from its
 * neighbours.
 *
 * @param dependencies sorted, distinct references: {@code var:x}, {@code template:x}, {@code
 *     function:p:x}
 * @param hasConditionals whether the text contains an {@code xsl:choose}
 * @param hasVariables whether the text declares a variable
 * @param hasXPath whether the text contains path expressions
 * @param complexityScore construct density per thousand characters, capped at {@value
 *     ChunkProfiler#MAX_COMPLEXITY}
 */
public record ChunkProfile(
    @JsonProperty("dependencies") List<String> dependencies,
    @JsonProperty("has_conditionals") boolean hasConditionals,
    @JsonProperty("has_variables") boolean hasVariables,
    @JsonProperty("has_xpath") boolean hasXPath,
    @JsonProperty("complexity_score") double complexityScore) {

  public ChunkProfile {
    dependencies = List.copyOf(dependencies);
  }
}
