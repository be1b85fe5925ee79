package com.dnobretech.teialigner.tei;

import com.dnobretech.teialigner.exception.TeiParseException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * Parses TEI input into a private jsoup tree. jsoup accepts anything, so well-formedness
 * is checked first with a StAX pass that rejects the whole input on the first error.
 */
@Slf4j
@Component
public class TeiParser {

    private final XMLInputFactory inputFactory;

    public TeiParser() {
        inputFactory = XMLInputFactory.newInstance();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, false);
    }

    public TeiDocument parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new TeiParseException("Invalid TEI XML: document is empty", null);
        }
        checkWellFormed(xml);

        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        doc.outputSettings()
                .prettyPrint(false)
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8);

        String language = extractLanguage(doc);
        String title = extractTitle(doc);
        log.debug("Parsed TEI '{}' (language={})", title, language);
        return new TeiDocument(doc, language, title);
    }

    private void checkWellFormed(String xml) {
        XMLStreamReader r = null;
        try {
            r = inputFactory.createXMLStreamReader(new StringReader(xml));
            while (r.hasNext()) r.next();
        } catch (XMLStreamException e) {
            log.warn("Rejected malformed TEI input: {}", e.getMessage());
            throw new TeiParseException("Invalid TEI XML: " + e.getMessage(), e);
        } finally {
            if (r != null) {
                try {
                    r.close();
                } catch (XMLStreamException e) {
                    log.debug("Could not close StAX reader", e);
                }
            }
        }
    }

    // teiHeader/profileDesc/langUsage/language/@ident
    private static String extractLanguage(Document doc) {
        for (Element el : doc.getAllElements()) {
            if (!"language".equals(TeiMarkup.localName(el.tagName()))) continue;
            Element parent = el.parent();
            if (parent == null || !"langUsage".equals(TeiMarkup.localName(parent.tagName()))) continue;
            String ident = el.attr("ident");
            if (!ident.isBlank()) return ident.trim();
        }
        return TeiMarkup.UNKNOWN_LANGUAGE;
    }

    private static String extractTitle(Document doc) {
        for (Element el : doc.getAllElements()) {
            if (!"title".equals(TeiMarkup.localName(el.tagName()))) continue;
            Element parent = el.parent();
            if (parent == null || !"titleStmt".equals(TeiMarkup.localName(parent.tagName()))) continue;
            String t = el.text().trim();
            return t.isEmpty() ? "Untitled" : t;
        }
        return "Untitled";
    }
}
