package com.dnobretech.teialigner.compose;

import com.dnobretech.teialigner.annotate.AlignmentGroup;
import com.dnobretech.teialigner.tei.TeiDocument;
import com.dnobretech.teialigner.tei.TeiMarkup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds the teiCorpus output: corpus header, one link per alignment group in a
 * standOff section, then both annotated documents.
 */
@Slf4j
@Component
public class CorpusComposer {

    static final String TEI_VERSION = "3.3.0";
    static final String LINK_GROUP_TYPE = "translation";
    static final String LINK_TYPE = "Linguistic";

    private final String title;
    private final String publication;

    public CorpusComposer(@Value("${teialigner.corpus.title:Aligned Parallel Texts}") String title,
                          @Value("${teialigner.corpus.publication:Aligned using embedding-based sentence alignment}") String publication) {
        this.title = title;
        this.publication = publication;
    }

    public ComposedOutput compose(TeiDocument source, TeiDocument target,
                                  String sourceLanguage, String targetLanguage,
                                  List<AlignmentGroup> groups) {
        Document out = Jsoup.parse("", "", Parser.xmlParser());
        out.outputSettings()
                .prettyPrint(false)
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8);

        XmlDeclaration decl = new XmlDeclaration("xml", false);
        decl.attr("version", "1.0");
        decl.attr("encoding", "UTF-8");
        out.appendChild(decl);
        newline(out);

        Element corpus = out.appendElement("teiCorpus")
                .attr("xmlns", TeiMarkup.TEI_NS)
                .attr("version", TEI_VERSION);
        newline(corpus);
        appendHeader(corpus, sourceLanguage, targetLanguage);
        newline(corpus);
        appendLinks(corpus, groups);
        newline(corpus);
        appendDocument(corpus, source);
        newline(corpus);
        appendDocument(corpus, target);
        newline(corpus);

        log.debug("CorpusComposer: {} links", groups.size());
        return new ComposedOutput(out.outerHtml(), groups.size());
    }

    private void appendHeader(Element corpus, String sourceLanguage, String targetLanguage) {
        Element header = corpus.appendElement("teiHeader");
        Element fileDesc = header.appendElement("fileDesc");
        fileDesc.appendElement("titleStmt").appendElement("title").text(title);
        fileDesc.appendElement("publicationStmt").appendElement("p").text(publication);

        Element langUsage = header.appendElement("profileDesc").appendElement("langUsage");
        langUsage.appendElement("language").attr("ident", sourceLanguage)
                .text("Source language: " + sourceLanguage);
        langUsage.appendElement("language").attr("ident", targetLanguage)
                .text("Target language: " + targetLanguage);
    }

    private void appendLinks(Element corpus, List<AlignmentGroup> groups) {
        Element linkGrp = corpus.appendElement("standOff")
                .appendElement("linkGrp").attr("type", LINK_GROUP_TYPE);
        for (AlignmentGroup g : groups) {
            newline(linkGrp);
            linkGrp.appendChild(emptyElement("link")
                    .attr(TeiMarkup.ID_ATTR, g.groupId())
                    .attr("target", g.targets())
                    .attr("type", LINK_TYPE));
        }
        if (!groups.isEmpty()) newline(linkGrp);
    }

    // parsed from "<name />" so the tag is marked self-closing and serializes as such
    private static Element emptyElement(String name) {
        return (Element) Parser.parseXmlFragment("<" + name + " />", "").get(0);
    }

    // top-level nodes verbatim, minus the XML declaration and doctype; other PIs stay
    private void appendDocument(Element corpus, TeiDocument doc) {
        boolean leading = true;
        for (Node node : doc.document().childNodes()) {
            if (node instanceof DocumentType) continue;
            if (node instanceof XmlDeclaration d && "xml".equalsIgnoreCase(d.name())) continue;
            // whitespace left over before the root by the dropped prolog
            if (leading && node instanceof TextNode t && t.isBlank()) continue;
            leading = false;
            corpus.appendChild(node.clone());
        }
    }

    private static void newline(Element parent) {
        parent.appendChild(new TextNode("\n"));
    }
}
