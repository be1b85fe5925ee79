package com.dnobretech.teialigner.compose;

import com.dnobretech.teialigner.TeiFixtures;
import com.dnobretech.teialigner.align.Granularity;
import com.dnobretech.teialigner.align.Participant;
import com.dnobretech.teialigner.align.Side;
import com.dnobretech.teialigner.annotate.AlignmentGroup;
import com.dnobretech.teialigner.annotate.IdentifiedParticipant;
import com.dnobretech.teialigner.tei.AlignableUnit;
import com.dnobretech.teialigner.tei.TeiDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CorpusComposerTest {

    private final CorpusComposer composer = new CorpusComposer("Aligned Parallel Texts", "Aligned for testing");

    private static AlignmentGroup group(String id, TeiDocument src, TeiDocument tgt, String srcId, String tgtId) {
        AlignableUnit su = TeiFixtures.extractor().extract(src).get(0);
        AlignableUnit tu = TeiFixtures.extractor().extract(tgt).get(0);
        return new AlignmentGroup(id, List.of(
                new IdentifiedParticipant(Participant.whole(Side.SOURCE, su), srcId),
                new IdentifiedParticipant(Participant.whole(Side.TARGET, tu), tgtId)), 0.9, Granularity.UNIT);
    }

    @Test
    void writesHeaderLinksAndBothDocuments() {
        TeiDocument src = TeiFixtures.parseResource("italian.xml");
        TeiDocument tgt = TeiFixtures.parseResource("english.xml");

        ComposedOutput out = composer.compose(src, tgt, "it", "en", List.of(group("g1", src, tgt, "a1", "b1")));

        assertThat(out.linkCount()).isEqualTo(1);
        assertThat(out.xml()).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<teiCorpus xmlns=\"http://www.tei-c.org/ns/1.0\" version=\"3.3.0\">");
        assertThat(out.xml()).contains(
                "<title>Aligned Parallel Texts</title>",
                "<p>Aligned for testing</p>",
                "<language ident=\"it\">Source language: it</language>",
                "<language ident=\"en\">Target language: en</language>",
                "<linkGrp type=\"translation\">",
                "<link xml:id=\"g1\" target=\"#a1 #b1\" type=\"Linguistic\" />");
        // the per-document XML declarations are dropped
        assertThat(out.xml().indexOf("<?xml")).isEqualTo(out.xml().lastIndexOf("<?xml"));

        Document parsed = Jsoup.parse(out.xml(), "", Parser.xmlParser());
        Element corpus = parsed.getElementsByTag("teiCorpus").first();
        assertThat(corpus.children()).extracting(Element::tagName)
                .containsExactly("teiHeader", "standOff", "TEI", "TEI");
    }

    @Test
    void documentsAreEmbeddedVerbatim() {
        TeiDocument src = TeiFixtures.parseResource("italian.xml");
        TeiDocument tgt = TeiFixtures.parseResource("english.xml");
        String srcRoot = src.document().getElementsByTag("TEI").first().outerHtml();
        String tgtRoot = tgt.document().getElementsByTag("TEI").first().outerHtml();

        ComposedOutput out = composer.compose(src, tgt, "it", "en", List.of());

        assertThat(out.xml()).contains(srcRoot, tgtRoot);
        assertThat(out.xml().indexOf(srcRoot)).isLessThan(out.xml().indexOf(tgtRoot));
        assertThat(out.linkCount()).isZero();
        // composing does not consume the input trees
        assertThat(src.document().getElementsByTag("TEI")).hasSize(1);
    }

    @Test
    void linksFollowGroupOrder() {
        TeiDocument src = TeiFixtures.parseTei("it", "<p>Uno.</p>");
        TeiDocument tgt = TeiFixtures.parseTei("en", "<p>One.</p>");

        ComposedOutput out = composer.compose(src, tgt, "it", "en", List.of(
                group("g1", src, tgt, "a1", "b1"),
                group("g2", src, tgt, "a2", "b2")));

        assertThat(out.xml().indexOf("xml:id=\"g1\"")).isLessThan(out.xml().indexOf("xml:id=\"g2\""));
    }

    @Test
    void linksAreWrittenAsEmptyElements() {
        TeiDocument src = TeiFixtures.parseTei("it", "<p>Uno.</p>");
        TeiDocument tgt = TeiFixtures.parseTei("en", "<p>One.</p>");

        ComposedOutput out = composer.compose(src, tgt, "it", "en", List.of(
                group("g1", src, tgt, "a1", "b1"),
                group("g2", src, tgt, "a2", "b2")));

        assertThat(out.xml()).contains(
                "<linkGrp type=\"translation\">\n"
                        + "<link xml:id=\"g1\" target=\"#a1 #b1\" type=\"Linguistic\" />\n"
                        + "<link xml:id=\"g2\" target=\"#a2 #b2\" type=\"Linguistic\" />\n"
                        + "</linkGrp>");
        assertThat(out.xml()).doesNotContain("</link>");
    }

    @Test
    void keepsTopLevelCommentsAndProcessingInstructions() {
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<?xml-model href=\"tei_all.rng\"?>\n"
                + "<!-- copyright -->\n" + TeiFixtures.tei("it", "<p>Uno.</p>");
        TeiDocument src = TeiFixtures.PARSER.parse(xml);
        TeiDocument tgt = TeiFixtures.parseTei("en", "<p>One.</p>");

        ComposedOutput out = composer.compose(src, tgt, "it", "en", List.of());

        assertThat(out.xml()).contains("<?xml-model href=\"tei_all.rng\"?>", "<!-- copyright -->");
    }
}
