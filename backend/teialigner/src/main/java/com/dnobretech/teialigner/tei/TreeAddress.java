package com.dnobretech.teialigner.tei;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Path of child indices from the document node down to a node.
 */
public final class TreeAddress {

    private TreeAddress() {
    }

    public static List<Integer> of(Node node) {
        List<Integer> path = new ArrayList<>();
        Node cur = node;
        while (cur.parentNode() != null) {
            path.add(cur.siblingIndex());
            cur = cur.parentNode();
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    public static Element resolveElement(Document doc, List<Integer> address) {
        Node cur = doc;
        for (int idx : address) {
            if (idx < 0 || idx >= cur.childNodeSize()) {
                throw new IllegalStateException("Stale tree address " + address);
            }
            cur = cur.childNode(idx);
        }
        if (!(cur instanceof Element el)) {
            throw new IllegalStateException("Tree address " + address + " does not point to an element");
        }
        return el;
    }
}
