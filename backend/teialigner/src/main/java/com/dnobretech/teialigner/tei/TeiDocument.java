package com.dnobretech.teialigner.tei;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A parsed TEI input. The tree is private to one request and is mutated in place by the annotator.
 */
public record TeiDocument(Document document, String language, String title) {

    public String serialize() {
        return document.outerHtml();
    }

    public Set<String> existingIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Element el : document.getAllElements()) {
            if (el.hasAttr(TeiMarkup.ID_ATTR)) ids.add(el.attr(TeiMarkup.ID_ATTR));
        }
        return ids;
    }
}
