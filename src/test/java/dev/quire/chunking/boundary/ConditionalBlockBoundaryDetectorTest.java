package dev.quire.chunking.boundary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import dev.quire.fixture.XsltFixtures;
import org.junit.jupiter.api.Test;

class ConditionalBlockBoundaryDetectorTest {

  private final ConditionalBlockBoundaryDetector detector = new ConditionalBlockBoundaryDetector();

  @Test
  void reportsOpenAndCloseOfOutermostChoose() {
    var document = new LineIndexedDocument(XsltFixtures.orderCreate(), "order-create.xslt");

    assertThat(detector.detect(document, new LineRange(5, 18)))
        .extracting(BoundaryCandidate::line, BoundaryCandidate::kind)
        .containsExactly(
            tuple(7, BoundaryKind.CONDITIONAL_BLOCK_START),
            tuple(17, BoundaryKind.CONDITIONAL_BLOCK_END));
  }

  @Test
  void nestedConditionalsAreNotReported() {
    var document =
        new LineIndexedDocument(
            """
            <xsl:template match="/">
              <xsl:choose>
                <xsl:when test="a">
                  <xsl:if test="b">
                  </xsl:if>
                </xsl:when>
              </xsl:choose>
              <xsl:if test="c"><X/></xsl:if>
            </xsl:template>
            """,
            "nested.xslt");

    assertThat(detector.detect(document, document.fullRange()))
        .extracting(BoundaryCandidate::line, BoundaryCandidate::kind)
        .containsExactly(
            tuple(2, BoundaryKind.CONDITIONAL_BLOCK_START),
            tuple(7, BoundaryKind.CONDITIONAL_BLOCK_END),
            tuple(8, BoundaryKind.CONDITIONAL_BLOCK_START),
            tuple(8, BoundaryKind.CONDITIONAL_BLOCK_END));
  }

  @Test
  void closingSplitFallsAfterItsLine() {
    var document = new LineIndexedDocument(XsltFixtures.orderCreate(), "order-create.xslt");

    BoundaryCandidate end = detector.detect(document, new LineRange(32, 71)).get(1);

    assertThat(end.line()).isEqualTo(67);
    assertThat(end.splitPosition()).isEqualTo(68);
  }

  @Test
  void unclosedOutermostConditionalStopsDetection() {
    var document =
        new LineIndexedDocument(
            """
            <xsl:if test="a">
              <X/>
              <xsl:if test="b">
              </xsl:if>
            """,
            "unclosed.xslt");

    assertThat(detector.detect(document, document.fullRange())).isEmpty();
  }

  @Test
  void selfClosingConditionalIsIgnored() {
    var document = new LineIndexedDocument("<xsl:if test=\"a\"/>\n<X/>", "empty-if.xslt");

    assertThat(detector.detect(document, document.fullRange())).isEmpty();
  }
}
