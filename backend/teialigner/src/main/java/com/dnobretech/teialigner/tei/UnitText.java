package com.dnobretech.teialigner.tei;

import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw text of a unit element and the raw-text range covered by each of its direct children.
 * Plain text children can be split at any offset; everything else is atomic.
 */
public record UnitText(String raw, List<ChildRange> children) {

    public record ChildRange(Node node, int start, int end, boolean splittable) {

        public boolean isEmpty() {
            return start == end;
        }

        // true when offset falls strictly inside a child that cannot be cut
        public boolean cutsAtomic(int offset) {
            return !splittable && start < offset && offset < end;
        }
    }

    public static UnitText of(Element unit) {
        StringBuilder raw = new StringBuilder();
        List<ChildRange> ranges = new ArrayList<>(unit.childNodeSize());
        for (Node child : unit.childNodes()) {
            int start = raw.length();
            appendText(child, raw);
            boolean splittable = child instanceof TextNode && !(child instanceof CDataNode);
            ranges.add(new ChildRange(child, start, raw.length(), splittable));
        }
        return new UnitText(raw.toString(), List.copyOf(ranges));
    }

    public static String rawText(Node node) {
        StringBuilder sb = new StringBuilder();
        appendText(node, sb);
        return sb.toString();
    }

    public static String rawText(List<Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node n : nodes) appendText(n, sb);
        return sb.toString();
    }

    private static void appendText(Node node, StringBuilder out) {
        if (node instanceof TextNode text) {
            // CDataNode is a TextNode as well
            out.append(text.getWholeText());
        } else if (node instanceof Element el) {
            for (Node child : el.childNodes()) appendText(child, out);
        }
        // comments, processing instructions and data nodes carry no text
    }

    public ChildRange atomicChildAt(int offset) {
        for (ChildRange c : children) {
            if (c.cutsAtomic(offset)) return c;
        }
        return null;
    }
}
