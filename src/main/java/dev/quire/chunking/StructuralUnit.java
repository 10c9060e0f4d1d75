package dev.quire.chunking;

import dev.quire.document.LineRange;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A top-level unit of a document: a template, a function, or an interstitial section between them.
 *
 * @param range lines of the unit
 * @param type classification of the unit
 * @param name template or function name, {@code match:<pattern>} for match templates, null for
 *     sections
 */
public record StructuralUnit(LineRange range, UnitType type, @Nullable String name) {

  public StructuralUnit {
    Objects.requireNonNull(range, "range must not be null");
    Objects.requireNonNull(type, "type must not be null");
  }
}
