package dev.quire.chunking;

import dev.quire.chunking.boundary.UnitBoundaryDetector;
import dev.quire.chunking.boundary.UnitBoundaryDetector.UnitSpan;
import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Cuts a whole document into top-level units that cover every line.
 *
 * <p>Templates and functions are units of their own. The lines between them (the stylesheet
 * preamble, global declarations, the closing root tag) form section units. Blank-only gaps are
 * absorbed into the preceding unit, or into the following one at the start of the document.
 */
@Component
public class UnitLocator {

  private final UnitBoundaryDetector unitDetector;
  private final UnitClassifier classifier;

  public UnitLocator(UnitBoundaryDetector unitDetector, UnitClassifier classifier) {
    this.unitDetector = unitDetector;
    this.classifier = classifier;
  }

  public List<StructuralUnit> locate(LineIndexedDocument document, List<String> helperPatterns) {
    List<StructuralUnit> units = new ArrayList<>();
    int next = 1;
    for (UnitSpan span : unitDetector.findUnits(document, document.fullRange())) {
      if (span.range().start() > next) {
        addGap(document, units, new LineRange(next, span.range().start() - 1));
      }
      StructuralUnit unit = classifier.classify(span, helperPatterns);
      if (units.isEmpty() && unit.range().start() > 1) {
        // blank preamble
        unit = extend(unit, 1, unit.range().end());
      }
      units.add(unit);
      next = span.range().end() + 1;
    }
    if (next <= document.lineCount()) {
      addGap(document, units, new LineRange(next, document.lineCount()));
    }
    return List.copyOf(units);
  }

  private void addGap(LineIndexedDocument document, List<StructuralUnit> units, LineRange gap) {
    if (document.isBlank(gap)) {
      if (!units.isEmpty()) {
        StructuralUnit previous = units.remove(units.size() - 1);
        units.add(extend(previous, previous.range().start(), gap.end()));
      }
      return;
    }
    String text = document.text(gap);
    UnitType type = classifier.classifySection(text);
    units.add(new StructuralUnit(gap, type, classifier.sectionName(type, text)));
  }

  private static StructuralUnit extend(StructuralUnit unit, int start, int end) {
    return new StructuralUnit(new LineRange(start, end), unit.type(), unit.name());
  }
}
