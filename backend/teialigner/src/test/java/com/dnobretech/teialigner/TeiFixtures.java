package com.dnobretech.teialigner;

import com.dnobretech.teialigner.segment.RegexSentenceSplitter;
import com.dnobretech.teialigner.segment.UnitSegmenter;
import com.dnobretech.teialigner.tei.TeiDocument;
import com.dnobretech.teialigner.tei.TeiParser;
import com.dnobretech.teialigner.tei.UnitExtractor;
import com.dnobretech.teialigner.util.TextNormalizer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public final class TeiFixtures {

    public static final TextNormalizer NORMALIZER = new TextNormalizer();
    public static final TeiParser PARSER = new TeiParser();

    private TeiFixtures() {
    }

    public static String resource(String name) {
        try (InputStream in = TeiFixtures.class.getResourceAsStream("/tei/" + name)) {
            if (in == null) throw new IllegalArgumentException("No fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static TeiDocument parseResource(String name) {
        return PARSER.parse(resource(name));
    }

    // minimal TEI document around the given body markup
    public static String tei(String language, String body) {
        return "<TEI xmlns=\"http://www.tei-c.org/ns/1.0\"><teiHeader><fileDesc><titleStmt><title>T</title></titleStmt>"
                + "</fileDesc><profileDesc><langUsage><language ident=\"" + language + "\">x</language></langUsage>"
                + "</profileDesc></teiHeader><text><body>" + body + "</body></text></TEI>";
    }

    public static TeiDocument parseTei(String language, String body) {
        return PARSER.parse(tei(language, body));
    }

    public static UnitExtractor extractor() {
        return new UnitExtractor(List.of("p", "head"), "body", NORMALIZER);
    }

    public static UnitSegmenter segmenter() {
        return new UnitSegmenter(new RegexSentenceSplitter(), NORMALIZER);
    }
}
