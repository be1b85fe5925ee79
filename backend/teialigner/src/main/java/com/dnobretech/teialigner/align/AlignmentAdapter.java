package com.dnobretech.teialigner.align;

import com.dnobretech.teialigner.exception.AlignmentException;
import com.dnobretech.teialigner.exception.DegenerateInputException;
import com.dnobretech.teialigner.segment.SentenceSpan;
import com.dnobretech.teialigner.segment.UnitSegmenter;
import com.dnobretech.teialigner.tei.AlignableUnit;
import com.dnobretech.teialigner.tei.TreeAddress;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Boundary to the aligner. Checks the coverage guarantee, drops one-sided results and
 * re-aligns multi-sentence correspondences at sentence level when that pays off.
 */
@Slf4j
@Component
public class AlignmentAdapter {

    private final UnitSegmenter segmenter;
    private final double promotionThreshold;
    private final boolean sentencePromotion;

    public AlignmentAdapter(UnitSegmenter segmenter,
                            @Value("${teialigner.alignment.promotion-threshold:0.5}") double promotionThreshold,
                            @Value("${teialigner.alignment.sentence-promotion:true}") boolean sentencePromotion) {
        this.segmenter = segmenter;
        this.promotionThreshold = promotionThreshold;
        this.sentencePromotion = sentencePromotion;
    }

    public List<AlignedCorrespondence> align(AlignmentSide source, AlignmentSide target,
                                             AlignConfig config, Aligner aligner) {
        if (source.units().isEmpty() || target.units().isEmpty()) {
            throw new DegenerateInputException("No alignable units (source=" + source.units().size()
                    + ", target=" + target.units().size() + ")");
        }

        List<Correspondence> raw = invoke(aligner, source.texts(), target.texts(), config);
        verifyCoverage(raw, source.units().size(), target.units().size());

        List<AlignedCorrespondence> out = new ArrayList<>();
        int dropped = 0, promoted = 0;
        for (Correspondence c : raw) {
            if (c.isOneSided()) {
                dropped++;
                continue;
            }
            List<Participant> src = c.sourceIndices().stream()
                    .map(i -> Participant.whole(Side.SOURCE, source.units().get(i))).toList();
            List<Participant> tgt = c.targetIndices().stream()
                    .map(j -> Participant.whole(Side.TARGET, target.units().get(j))).toList();
            AlignedCorrespondence whole = new AlignedCorrespondence(src, tgt, c.score(), Granularity.UNIT);

            List<AlignedCorrespondence> subs = sentencePromotion
                    ? promote(whole, source, target, config, aligner)
                    : List.of();
            if (subs.isEmpty()) {
                out.add(whole);
            } else {
                out.addAll(subs);
                promoted++;
            }
        }

        log.info("[tei-align] adapter: {} correspondences, {} one-sided dropped, {} promoted to sentences, {} retained",
                raw.size(), dropped, promoted, out.size());
        return out;
    }

    // empty list = keep the whole-unit correspondence
    private List<AlignedCorrespondence> promote(AlignedCorrespondence whole, AlignmentSide source,
                                                AlignmentSide target, AlignConfig config, Aligner aligner) {
        List<Participant> srcSentences;
        List<Participant> tgtSentences;
        try {
            srcSentences = sentences(whole.source(), source);
            tgtSentences = sentences(whole.target(), target);
        } catch (RuntimeException e) {
            log.debug("Sentence split failed, keeping whole units {}: {}", unitIndices(whole), e.getMessage());
            return List.of();
        }

        if (srcSentences.isEmpty() || tgtSentences.isEmpty()) {
            log.debug("No sentence spans for units {}, keeping whole units", unitIndices(whole));
            return List.of();
        }
        if (srcSentences.size() <= whole.source().size() && tgtSentences.size() <= whole.target().size()) {
            // one sentence per unit on both sides: nothing finer to align
            return List.of();
        }

        List<String> srcTexts = srcSentences.stream().map(Participant::text).toList();
        List<String> tgtTexts = tgtSentences.stream().map(Participant::text).toList();
        List<Correspondence> subs = invoke(aligner, srcTexts, tgtTexts, config);
        verifyCoverage(subs, srcTexts.size(), tgtTexts.size());

        List<AlignedCorrespondence> out = new ArrayList<>();
        for (Correspondence c : subs) {
            if (c.isOneSided() || c.score() <= promotionThreshold) continue;
            out.add(new AlignedCorrespondence(
                    c.sourceIndices().stream().map(srcSentences::get).toList(),
                    c.targetIndices().stream().map(tgtSentences::get).toList(),
                    c.score(),
                    Granularity.SENTENCE));
        }
        if (out.isEmpty()) {
            log.debug("No sentence correspondence above {} for units {}, keeping whole units",
                    promotionThreshold, unitIndices(whole));
        } else if (out.size() == 1
                && out.get(0).source().size() == srcSentences.size()
                && out.get(0).target().size() == tgtSentences.size()) {
            // every sentence in one bead: no finer split than the units themselves
            log.debug("Re-alignment regrouped all sentences of units {}, keeping whole units", unitIndices(whole));
            return List.of();
        }
        return out;
    }

    // a unit with a single sentence takes part as a whole
    private List<Participant> sentences(List<Participant> units, AlignmentSide side) {
        List<Participant> out = new ArrayList<>();
        for (Participant p : units) {
            AlignableUnit unit = p.unit();
            Element el = TreeAddress.resolveElement(side.doc().document(), unit.address());
            List<SentenceSpan> spans = segmenter.segment(el, side.language());
            if (spans.size() == 1) {
                out.add(p);
            } else {
                for (SentenceSpan span : spans) out.add(new Participant(p.side(), unit, span));
            }
        }
        return out;
    }

    private static List<Correspondence> invoke(Aligner aligner, List<String> src, List<String> tgt,
                                               AlignConfig config) {
        try {
            List<Correspondence> result = aligner.align(src, tgt, config);
            if (result == null) throw new AlignmentException("Aligner returned no result");
            return result;
        } catch (AlignmentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlignmentException("Aligner failed on " + src.size() + "x" + tgt.size() + " items", e);
        }
    }

    static void verifyCoverage(List<Correspondence> correspondences, int n, int m) {
        int[] srcSeen = new int[n];
        int[] tgtSeen = new int[m];
        for (Correspondence c : correspondences) {
            for (int i : c.sourceIndices()) count(srcSeen, i, "source");
            for (int j : c.targetIndices()) count(tgtSeen, j, "target");
        }
        for (int i = 0; i < n; i++) {
            if (srcSeen[i] != 1) throw new AlignmentException("Source index " + i + " covered " + srcSeen[i] + " times");
        }
        for (int j = 0; j < m; j++) {
            if (tgtSeen[j] != 1) throw new AlignmentException("Target index " + j + " covered " + tgtSeen[j] + " times");
        }
    }

    private static void count(int[] seen, int idx, String side) {
        if (idx < 0 || idx >= seen.length) {
            throw new AlignmentException("Aligner returned " + side + " index " + idx + " out of range 0.." + (seen.length - 1));
        }
        seen[idx]++;
    }

    private static String unitIndices(AlignedCorrespondence c) {
        return c.source().stream().map(p -> p.unit().index()).toList() + "->"
                + c.target().stream().map(p -> p.unit().index()).toList();
    }
}
