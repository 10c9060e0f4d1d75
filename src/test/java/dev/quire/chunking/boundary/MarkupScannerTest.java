package dev.quire.chunking.boundary;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quire.document.LineIndexedDocument;
import dev.quire.document.LineRange;
import java.util.List;
import org.junit.jupiter.api.Test;

class MarkupScannerTest {

  private static MarkupScan scan(String text) {
    var document = new LineIndexedDocument(text, "scan");
    return MarkupScanner.scan(document, document.fullRange());
  }

  @Test
  void tracksDepthAndPairsOpenWithClose() {
    MarkupScan scan =
        scan(
            """
            <xsl:template match="/">
              <Out>
                <xsl:value-of select="a"/>
              </Out>
            </xsl:template>
            """);

    List<TagEvent> events = scan.events();
    assertThat(events).extracting(TagEvent::name)
        .containsExactly("xsl:template", "Out", "xsl:value-of", "Out", "xsl:template");
    assertThat(events).extracting(TagEvent::depth).containsExactly(0, 1, 2, 1, 0);
    assertThat(events).extracting(TagEvent::type)
        .containsExactly(
            TagEvent.Type.OPEN,
            TagEvent.Type.OPEN,
            TagEvent.Type.SELF_CLOSING,
            TagEvent.Type.CLOSE,
            TagEvent.Type.CLOSE);
    assertThat(scan.partnerIndex(events.get(0))).isEqualTo(4);
    assertThat(scan.endLineOf(events.get(1))).hasValue(4);
    assertThat(scan.endLineOf(events.get(2))).hasValue(3);
    assertThat(scan.baseDepth()).isEqualTo(1);
    assertThat(scan.desynchronized()).isFalse();
  }

  @Test
  void skipsCommentsCdataAndProcessingInstructions() {
    MarkupScan scan =
        scan(
            """
            <?xml version="1.0"?>
            <!-- <Fake> -->
            <!-- spans
              <Hidden>
            lines -->
            <root><![CDATA[ <NotATag> ]]></root>
            """);

    assertThat(scan.events()).extracting(TagEvent::name).containsExactly("root", "root");
  }

  @Test
  void tagMaySpanSeveralLines() {
    MarkupScan scan =
        scan(
            """
            <xsl:template
                name="vmf:vmf1_inputtoresult"
                mode="m">
            </xsl:template>
            """);

    TagEvent open = scan.events().get(0);
    assertThat(open.line()).isEqualTo(1);
    assertThat(open.endLine()).isEqualTo(3);
    assertThat(open.attribute("name")).isEqualTo("vmf:vmf1_inputtoresult");
    assertThat(open.attribute("mode")).isEqualTo("m");
    assertThat(open.attribute("match")).isNull();
  }

  @Test
  void greaterThanInsideQuotedValueDoesNotEndTag() {
    MarkupScan scan = scan("<xsl:if test=\"count(a) > 2\">\n</xsl:if>");

    assertThat(scan.events()).hasSize(2);
    assertThat(scan.events().get(0).attribute("test")).isEqualTo("count(a) > 2");
  }

  @Test
  void singleQuotedAttributesAreRead() {
    MarkupScan scan = scan("<xsl:variable name='total' select='sum(//@amount)'/>");

    assertThat(scan.events().get(0).attribute("name")).isEqualTo("total");
  }

  @Test
  void strayLessThanIsText() {
    MarkupScan scan = scan("x < 3 and <y/>");

    assertThat(scan.events()).extracting(TagEvent::name).containsExactly("y");
  }

  @Test
  void recordsWhetherTagsStartAndEndTheirLine() {
    MarkupScan scan = scan("  <a>text</a>\n<b/>  ");

    TagEvent open = scan.events().get(0);
    TagEvent close = scan.events().get(1);
    TagEvent single = scan.events().get(2);
    assertThat(open.lineStart()).isTrue();
    assertThat(open.lineEnd()).isFalse();
    assertThat(close.lineStart()).isFalse();
    assertThat(close.lineEnd()).isTrue();
    assertThat(single.lineStart()).isTrue();
    assertThat(single.lineEnd()).isTrue();
    assertThat(open.indent()).isEqualTo(2);
  }

  @Test
  void mismatchedCloseMarksThatAndLaterEventsAmbiguous() {
    MarkupScan scan = scan("<a>\n<b>\n</a>\n<c/>");

    assertThat(scan.desynchronized()).isTrue();
    assertThat(scan.events()).extracting(TagEvent::ambiguous)
        .containsExactly(false, false, true, true);
  }

  @Test
  void closeOfElementOpenedBeforeRangeHasNegativeDepth() {
    var document = new LineIndexedDocument("<a>\n<b/>\n</a>", "scan");

    MarkupScan scan = MarkupScanner.scan(document, new LineRange(2, 3));

    assertThat(scan.events()).extracting(TagEvent::depth).containsExactly(0, -1);
    assertThat(scan.desynchronized()).isFalse();
    assertThat(scan.baseDepth()).isZero();
  }

  @Test
  void baseDepthIsZeroWithoutSingleEnclosingElement() {
    assertThat(scan("<a>\n</a>\n<b>\n</b>").baseDepth()).isZero();
    assertThat(scan("<a/>\n<b></b>").baseDepth()).isZero();
  }
}
