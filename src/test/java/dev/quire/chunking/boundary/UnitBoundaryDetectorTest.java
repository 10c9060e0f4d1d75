package dev.quire.chunking.boundary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.quire.chunking.boundary.UnitBoundaryDetector.UnitSpan;
import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import dev.quire.fixture.XsltFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class UnitBoundaryDetectorTest {

  private final UnitBoundaryDetector detector = new UnitBoundaryDetector();

  @Test
  void findsTopLevelTemplatesWithNames() {
    var document = new LineIndexedDocument(XsltFixtures.orderCreate(), "order-create.xslt");

    List<UnitSpan> units = detector.findUnits(document, document.fullRange());

    assertThat(units)
        .extracting(UnitSpan::range, UnitSpan::name)
        .containsExactly(
            tuple(new LineRange(5, 18), "vmf:vmf1_inputtoresult"),
            tuple(new LineRange(20, 30), "vmf:vmf2_inputtoresult"),
            tuple(new LineRange(32, 71), "match:/"));
  }

  @Test
  void reportsStartAndEndOfEachUnit() {
    var document = new LineIndexedDocument(XsltFixtures.orderCreate(), "order-create.xslt");

    List<BoundaryCandidate> candidates = detector.detect(document, document.fullRange());

    assertThat(candidates)
        .extracting(BoundaryCandidate::line, BoundaryCandidate::kind)
        .containsExactly(
            tuple(5, BoundaryKind.UNIT_START),
            tuple(18, BoundaryKind.UNIT_END),
            tuple(20, BoundaryKind.UNIT_START),
            tuple(30, BoundaryKind.UNIT_END),
            tuple(32, BoundaryKind.UNIT_START),
            tuple(71, BoundaryKind.UNIT_END));
    assertThat(candidates.get(0).label()).isEqualTo("<xsl:template vmf:vmf1_inputtoresult>");
    assertThat(candidates.get(1).splitPosition()).isEqualTo(19);
  }

  @Test
  void functionsAreUnits() {
    var document =
        new LineIndexedDocument(
            """
            <xsl:function name="f:twice">
              <xsl:param name="n"/>
              <xsl:sequence select="$n * 2"/>
            </xsl:function>
            """,
            "functions.xslt");

    List<UnitSpan> units = detector.findUnits(document, document.fullRange());

    assertThat(units).singleElement().satisfies(unit -> {
      assertThat(unit.isFunction()).isTrue();
      assertThat(unit.name()).isEqualTo("f:twice");
      assertThat(unit.range()).isEqualTo(new LineRange(1, 4));
    });
  }

  @Test
  void unclosedTemplateIsOmitted() {
    var document =
        new LineIndexedDocument(
            """
            <xsl:template name="complete">
            </xsl:template>
            <xsl:template name="truncated">
              <Out/>
            """,
            "truncated.xslt");

    assertThat(detector.findUnits(document, document.fullRange()))
        .extracting(UnitSpan::name)
        .containsExactly("complete");
  }

  @Test
  void templateNotStartingItsLineIsIgnored() {
    var document =
        new LineIndexedDocument(
            "<root><xsl:template name=\"inline\"></xsl:template></root>", "inline.xslt");

    assertThat(detector.detect(document, document.fullRange())).isEmpty();
  }

  @Test
  void unitsAfterAmbiguousNestingAreOmitted() {
    var document =
        new LineIndexedDocument(
            """
            <xsl:template name="first">
              <Open>
            </xsl:template>
            <xsl:template name="second">
            </xsl:template>
            """,
            "broken.xslt");

    assertThat(detector.findUnits(document, document.fullRange())).isEmpty();
  }
}
