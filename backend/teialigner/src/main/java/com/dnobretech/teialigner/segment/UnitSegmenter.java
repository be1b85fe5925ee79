package com.dnobretech.teialigner.segment;

import com.dnobretech.teialigner.tei.UnitText;
import com.dnobretech.teialigner.util.TextNormalizer;
import com.dnobretech.teialigner.util.TextNormalizer.NormalizedText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns splitter output into sentence spans that can be wrapped in the live tree.
 * A boundary may only fall between direct children or inside a plain text child;
 * boundaries inside child elements are widened to the child's edges and
 * sentences that end up overlapping are merged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnitSegmenter {

    private final SentenceSplitter splitter;
    private final TextNormalizer norm;

    public List<SentenceSpan> segment(Element unit, String language) {
        UnitText ut = UnitText.of(unit);
        NormalizedText nt = norm.normalizeWithOffsets(ut.raw());
        String text = nt.text();
        if (text.isEmpty()) return List.of();

        List<int[]> ranges = new ArrayList<>();
        for (SentenceSplitter.Span span : splitter.split(text, language)) {
            int s = span.start(), e = span.end();
            while (s < e && text.charAt(s) == ' ') s++;
            while (e > s && text.charAt(e - 1) == ' ') e--;
            if (s == e) continue;

            int rs = nt.rawStart(s);
            int re = nt.rawEnd(e);
            UnitText.ChildRange c = ut.atomicChildAt(rs);
            if (c != null) rs = c.start();
            c = ut.atomicChildAt(re);
            if (c != null) re = c.end();

            int[] last = ranges.isEmpty() ? null : ranges.get(ranges.size() - 1);
            if (last != null && rs < last[1]) {
                last[1] = Math.max(last[1], re);
            } else {
                ranges.add(new int[]{rs, re});
            }
        }

        List<SentenceSpan> out = new ArrayList<>(ranges.size());
        for (int[] r : ranges) {
            String sentence = norm.normalize(ut.raw().substring(r[0], r[1]));
            if (sentence.isEmpty()) continue;
            out.add(new SentenceSpan(out.size(), normIndex(nt, r[0]), normIndex(nt, r[1]), r[0], r[1], sentence));
        }
        if (out.size() != ranges.size()) {
            log.debug("UnitSegmenter: dropped {} blank ranges in <{}>", ranges.size() - out.size(), unit.tagName());
        }
        return out;
    }

    // first normalized position whose raw offset is >= raw
    private static int normIndex(NormalizedText nt, int raw) {
        int[] offsets = nt.rawOffsets();
        int i = 0;
        while (i < offsets.length && offsets[i] < raw) i++;
        return i;
    }
}
