package dev.quire.chunking.boundary;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Detects clusters of consecutive {@code xsl:variable} / {@code xsl:param} declarations.
 *
 * <p>Declarations at the same depth separated only by blank lines belong to one cluster, reported
 * once at its first line. Declarations nested inside another declaration's body are ignored.
 */
@Component
public class VariableClusterBoundaryDetector implements BoundaryDetector {

  static final int MAX_LABEL_NAMES = 3;

  @Override
  public List<BoundaryCandidate> detect(LineIndexedDocument document, LineRange range) {
    MarkupScan scan = MarkupScanner.scan(document, range);
    List<BoundaryCandidate> candidates = new ArrayList<>();

    @Nullable TagEvent first = null;
    boolean reportable = false;
    List<String> names = new ArrayList<>();
    int clusterEnd = 0;
    int insideDeclarationUntil = -1;

    for (TagEvent event : scan.events()) {
      if (event.ambiguous()) {
        break;
      }
      if (!event.isOpening()
          || !XslNames.DECLARATIONS.contains(event.name())
          || event.index() < insideDeclarationUntil) {
        continue;
      }
      OptionalInt end = scan.endLineOf(event);
      if (end.isEmpty()) {
        continue;
      }
      insideDeclarationUntil = scan.partnerIndex(event);

      boolean continues =
          first != null
              && event.depth() == first.depth()
              && onlyBlankBetween(document, clusterEnd, event.line());
      if (!continues) {
        if (first != null && reportable) {
          candidates.add(candidate(first, names));
        }
        names.clear();
        first = event;
        reportable = event.lineStart();
      }
      @Nullable String name = event.attribute("name");
      names.add(name != null ? name : "?");
      clusterEnd = end.getAsInt();
    }
    if (first != null && reportable) {
      candidates.add(candidate(first, names));
    }
    return candidates;
  }

  private static boolean onlyBlankBetween(LineIndexedDocument document, int after, int before) {
    return before - after <= 1 || document.isBlank(new LineRange(after + 1, before - 1));
  }

  private static BoundaryCandidate candidate(TagEvent first, List<String> names) {
    String label =
        "variables: "
            + String.join(", ", names.subList(0, Math.min(MAX_LABEL_NAMES, names.size())))
            + (names.size() > MAX_LABEL_NAMES
                ? " (+" + (names.size() - MAX_LABEL_NAMES) + ")"
                : "");
    return BoundaryCandidate.of(first.line(), BoundaryKind.VARIABLE_CLUSTER_START, label);
  }
}
