package com.dnobretech.teialigner.annotate;

import com.dnobretech.teialigner.align.Side;
import com.dnobretech.teialigner.segment.SentenceSpan;
import com.dnobretech.teialigner.tei.AlignableUnit;
import com.dnobretech.teialigner.tei.TeiDocument;
import com.dnobretech.teialigner.tei.TeiMarkup;
import com.dnobretech.teialigner.tei.TreeAddress;
import com.dnobretech.teialigner.tei.UnitText;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Tag;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes participant identifiers into one document tree, in place.
 * <p>
 * A whole-unit participant gets an {@code xml:id} attribute on its element (or, if the
 * element already has one, a single {@code seg} around all of its content). Sentence
 * participants each get a {@code seg} around the children covering the sentence; text
 * nodes are split at sentence edges, everything else is moved as is.
 */
@Slf4j
@Component
public class TreeAnnotator {

    public AnnotationResult annotate(TeiDocument doc, Side side, List<AlignmentGroup> groups) {
        Map<Integer, List<IdentifiedParticipant>> byUnit = new LinkedHashMap<>();
        for (AlignmentGroup g : groups) {
            for (IdentifiedParticipant p : g.on(side)) {
                byUnit.computeIfAbsent(p.participant().unit().index(), k -> new ArrayList<>()).add(p);
            }
        }

        // resolve everything first: annotating an outer unit moves its inner units
        Map<Integer, Element> elements = new LinkedHashMap<>();
        for (List<IdentifiedParticipant> ps : byUnit.values()) {
            AlignableUnit unit = ps.get(0).participant().unit();
            elements.put(unit.index(), TreeAddress.resolveElement(doc.document(), unit.address()));
        }

        Set<String> attributeIds = new HashSet<>();
        Set<String> wrapperIds = new HashSet<>();
        Map<Integer, UnitState> states = new LinkedHashMap<>();

        for (Map.Entry<Integer, List<IdentifiedParticipant>> e : byUnit.entrySet()) {
            Element el = elements.get(e.getKey());
            List<IdentifiedParticipant> ps = e.getValue();
            UnitState state = stateOf(ps);
            switch (state) {
                case WHOLE -> annotateWhole(el, ps.get(0).id(), attributeIds, wrapperIds);
                case PARTIAL -> annotatePartial(el, ps, wrapperIds);
                case NONE -> {
                    // nothing to write
                }
            }
            states.put(e.getKey(), state);
            log.debug("{} unit #{} <{}>: {} ({} ids)", side, e.getKey(), el.tagName(), state, ps.size());
        }

        return new AnnotationResult(attributeIds, wrapperIds, states);
    }

    static UnitState stateOf(List<IdentifiedParticipant> ps) {
        if (ps.isEmpty()) return UnitState.NONE;
        long whole = ps.stream().filter(p -> p.participant().isWholeUnit()).count();
        if (whole == 0) return UnitState.PARTIAL;
        if (whole == 1 && ps.size() == 1) return UnitState.WHOLE;
        throw new IllegalStateException("Unit #" + ps.get(0).participant().unit().index()
                + " has " + whole + " whole-unit and " + (ps.size() - whole) + " sentence participants");
    }

    private void annotateWhole(Element el, String id, Set<String> attributeIds, Set<String> wrapperIds) {
        if (!el.hasAttr(TeiMarkup.ID_ATTR)) {
            el.attr(TeiMarkup.ID_ATTR, id);
            attributeIds.add(id);
            return;
        }
        // keep the author's xml:id; the whole content goes into one wrapper
        Element seg = newSeg(el, id);
        List<Node> children = new ArrayList<>(el.childNodes());
        el.appendChild(seg);
        for (Node child : children) seg.appendChild(child);
        wrapperIds.add(id);
    }

    private void annotatePartial(Element el, List<IdentifiedParticipant> ps, Set<String> wrapperIds) {
        List<IdentifiedParticipant> ordered = new ArrayList<>(ps);
        ordered.sort(Comparator.comparingInt(p -> p.participant().span().rawStart()));

        TreeSet<Integer> cuts = new TreeSet<>(Comparator.reverseOrder());
        for (IdentifiedParticipant p : ordered) {
            cuts.add(p.participant().span().rawStart());
            cuts.add(p.participant().span().rawEnd());
        }
        for (int cut : cuts) splitTextAt(el, cut);

        UnitText ut = UnitText.of(el);
        for (IdentifiedParticipant p : ordered) {
            SentenceSpan span = p.participant().span();
            List<Node> inside = childrenWithin(ut, span.rawStart(), span.rawEnd());
            if (inside.isEmpty()) {
                throw new IllegalStateException("Sentence " + span.index() + " of <" + el.tagName()
                        + "> covers no content");
            }
            String covered = UnitText.rawText(inside);
            if (covered.length() != span.rawEnd() - span.rawStart()) {
                throw new IllegalStateException("Sentence " + span.index() + " of <" + el.tagName()
                        + "> does not fall on child boundaries");
            }
            Element seg = newSeg(el, p.id());
            inside.get(0).before(seg);
            for (Node child : inside) seg.appendChild(child);
            wrapperIds.add(p.id());
        }
    }

    // splits the plain text child that strictly contains raw offset `at`
    private static void splitTextAt(Element el, int at) {
        for (UnitText.ChildRange c : UnitText.of(el).children()) {
            if (c.splittable() && c.start() < at && at < c.end()) {
                ((TextNode) c.node()).splitText(at - c.start());
                return;
            }
        }
    }

    // zero-length children sitting on either edge stay outside
    private static List<Node> childrenWithin(UnitText ut, int start, int end) {
        List<Node> out = new ArrayList<>();
        for (UnitText.ChildRange c : ut.children()) {
            if (c.start() < start || c.end() > end) continue;
            if (c.isEmpty() && (c.start() == start || c.start() == end)) continue;
            out.add(c.node());
        }
        return out;
    }

    // same namespace prefix as the unit: <tei:p> gets <tei:seg>
    private static Element newSeg(Element unit, String id) {
        String tag = unit.tagName();
        int colon = tag.indexOf(':');
        String name = colon < 0 ? TeiMarkup.SEG : tag.substring(0, colon + 1) + TeiMarkup.SEG;
        Element seg = new Element(Tag.valueOf(name, ParseSettings.preserveCase), "");
        seg.attr(TeiMarkup.ID_ATTR, id);
        return seg;
    }
}
