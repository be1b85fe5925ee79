package com.dnobretech.teialigner.service.impl;

import com.dnobretech.teialigner.align.AlignConfig;
import com.dnobretech.teialigner.align.AlignedCorrespondence;
import com.dnobretech.teialigner.align.Aligner;
import com.dnobretech.teialigner.align.AlignmentAdapter;
import com.dnobretech.teialigner.align.AlignmentSide;
import com.dnobretech.teialigner.align.Side;
import com.dnobretech.teialigner.annotate.AlignmentGroup;
import com.dnobretech.teialigner.annotate.AnnotationResult;
import com.dnobretech.teialigner.annotate.AnnotationStripper;
import com.dnobretech.teialigner.annotate.IdentifierAssigner;
import com.dnobretech.teialigner.annotate.TreeAnnotator;
import com.dnobretech.teialigner.compose.ComposedOutput;
import com.dnobretech.teialigner.compose.CorpusComposer;
import com.dnobretech.teialigner.dto.TeiAlignmentRequest;
import com.dnobretech.teialigner.dto.TeiAlignmentResponse;
import com.dnobretech.teialigner.service.AlignmentGate;
import com.dnobretech.teialigner.service.TeiAlignmentService;
import com.dnobretech.teialigner.tei.AlignableUnit;
import com.dnobretech.teialigner.tei.TeiDocument;
import com.dnobretech.teialigner.tei.TeiMarkup;
import com.dnobretech.teialigner.tei.TeiParser;
import com.dnobretech.teialigner.tei.UnitExtractor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Slf4j
@Service
public class TeiAlignmentServiceImpl implements TeiAlignmentService {

    static final String FALLBACK_LANGUAGE = "en";

    // ===== Config =====
    @Value("${teialigner.aligner.default-mode:embedding}")
    private String defaultMode = "embedding";

    @Value("${teialigner.verify-roundtrip:true}")
    private boolean verifyRoundtrip = true;

    // ===== Pipeline =====
    private final TeiParser parser;
    private final UnitExtractor extractor;
    private final AlignmentAdapter adapter;
    private final IdentifierAssigner assigner;
    private final TreeAnnotator annotator;
    private final AnnotationStripper stripper;
    private final CorpusComposer composer;
    private final AlignmentGate gate;

    // Aligners (@Component("lengthAligner") / @Component("embeddingAligner"))
    private final Aligner lengthAligner;
    private final Aligner embeddingAligner;

    public TeiAlignmentServiceImpl(TeiParser parser, UnitExtractor extractor, AlignmentAdapter adapter,
                                   IdentifierAssigner assigner, TreeAnnotator annotator,
                                   AnnotationStripper stripper, CorpusComposer composer, AlignmentGate gate,
                                   @Qualifier("lengthAligner") Aligner lengthAligner,
                                   @Qualifier("embeddingAligner") Aligner embeddingAligner) {
        this.parser = parser;
        this.extractor = extractor;
        this.adapter = adapter;
        this.assigner = assigner;
        this.annotator = annotator;
        this.stripper = stripper;
        this.composer = composer;
        this.gate = gate;
        this.lengthAligner = lengthAligner;
        this.embeddingAligner = embeddingAligner;
    }

    @Override
    public TeiAlignmentResponse align(TeiAlignmentRequest request) {
        long t0 = System.nanoTime();

        // 1) parse; config first so bad parameters fail before any heavy work
        AlignConfig config = request.toConfig();
        TeiDocument source = parser.parse(request.sourceTei());
        TeiDocument target = parser.parse(request.targetTei());

        // 2) request language > header language > "en"
        String srcLang = resolveLanguage(request.sourceLanguage(), source.language());
        String tgtLang = resolveLanguage(request.targetLanguage(), target.language());
        requireSupported(srcLang, "source");
        requireSupported(tgtLang, "target");

        // 3) align, annotate, compose
        ComposedOutput out = annotate(source, target, srcLang, tgtLang, config, request.mode());

        double seconds = (System.nanoTime() - t0) / 1e9;
        log.info("[tei-align] '{}' ({}) <-> '{}' ({}): {} links in {}s",
                source.title(), srcLang, target.title(), tgtLang, out.linkCount(),
                String.format(Locale.ROOT, "%.3f", seconds));
        return new TeiAlignmentResponse(out.xml(), srcLang, tgtLang, out.linkCount(), seconds);
    }

    @Override
    public ComposedOutput annotate(TeiDocument source, TeiDocument target,
                                   String sourceLanguage, String targetLanguage,
                                   AlignConfig config, String mode) {
        String srcOriginal = verifyRoundtrip ? source.serialize() : null;
        String tgtOriginal = verifyRoundtrip ? target.serialize() : null;

        List<AlignableUnit> srcUnits = extractor.extract(source);
        List<AlignableUnit> tgtUnits = extractor.extract(target);
        log.info("[tei-align] units: source={} target={} (mode={})", srcUnits.size(), tgtUnits.size(), modeOf(mode));

        Aligner aligner = aligner(mode);
        List<AlignedCorrespondence> correspondences = gate.run(() -> adapter.align(
                new AlignmentSide(source, srcUnits, sourceLanguage),
                new AlignmentSide(target, tgtUnits, targetLanguage),
                config, aligner));

        List<AlignmentGroup> groups = assigner.assign(correspondences, source, target);

        AnnotationResult srcResult = annotator.annotate(source, Side.SOURCE, groups);
        AnnotationResult tgtResult = annotator.annotate(target, Side.TARGET, groups);
        if (verifyRoundtrip) {
            verify(source, srcResult, srcOriginal, Side.SOURCE);
            verify(target, tgtResult, tgtOriginal, Side.TARGET);
        }

        return composer.compose(source, target, sourceLanguage, targetLanguage, groups);
    }

    // ===== Helpers =====

    static String resolveLanguage(String requested, String fromHeader) {
        if (requested != null && !requested.isBlank()) return requested.trim().toLowerCase(Locale.ROOT);
        if (fromHeader != null && !fromHeader.isBlank() && !TeiMarkup.UNKNOWN_LANGUAGE.equals(fromHeader)) {
            return fromHeader.trim().toLowerCase(Locale.ROOT);
        }
        return FALLBACK_LANGUAGE;
    }

    private static void requireSupported(String language, String side) {
        if (!SUPPORTED_LANGUAGES.contains(language)) {
            throw new IllegalArgumentException("Unsupported " + side + " language '" + language
                    + "'. Supported: " + SUPPORTED_LANGUAGES.stream().sorted().toList());
        }
    }

    private String modeOf(String mode) {
        return mode == null || mode.isBlank() ? defaultMode : mode;
    }

    private Aligner aligner(String mode) {
        String m = modeOf(mode);
        if ("length".equalsIgnoreCase(m)) return lengthAligner;
        if ("embedding".equalsIgnoreCase(m)) return embeddingAligner;
        throw new IllegalArgumentException("Unknown alignment mode '" + m + "'");
    }

    // strip a copy of the annotated tree and compare with the input serialization
    private void verify(TeiDocument doc, AnnotationResult result, String original, Side side) {
        Document copy = doc.document().clone();
        stripper.strip(copy, result);
        if (!copy.outerHtml().equals(original)) {
            log.error("[tei-align] {} tree changed outside the inserted annotations", side);
            throw new IllegalStateException("Annotation round-trip check failed for " + side.name().toLowerCase(Locale.ROOT));
        }
    }
}
