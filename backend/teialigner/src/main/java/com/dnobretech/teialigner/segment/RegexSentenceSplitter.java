package com.dnobretech.teialigner.segment;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits after sentence terminators. Latin terminators need following whitespace,
 * CJK ones do not. Abbreviations, initials and lowercase continuations do not end a sentence.
 */
@Component
public class RegexSentenceSplitter implements SentenceSplitter {

    // terminator + optional closing quotes/brackets + the whitespace that follows
    private static final Pattern BREAK = Pattern.compile(
            "[.!?…]+[\"'”’»)\\]]*(?:\\s+|$)|[。！？]+[」』”’）)]*\\s*");

    private static final Map<String, Set<String>> ABBREVIATIONS = Map.of(
            "en", Set.of("mr", "mrs", "ms", "dr", "prof", "st", "jr", "sr", "vs", "etc", "e.g", "i.e",
                    "no", "fig", "vol", "pp", "cf", "ca", "ch"),
            "pt", Set.of("sr", "sra", "dr", "dra", "prof", "profa", "etc", "pág", "cap", "núm", "p", "ex"),
            "es", Set.of("sr", "sra", "srta", "dr", "dra", "ud", "uds", "etc", "pág", "cap", "núm", "p"),
            "fr", Set.of("m", "mme", "mlle", "dr", "etc", "p", "cf", "av", "chap", "vol"),
            "it", Set.of("sig", "sigg", "sig.ra", "dott", "prof", "ecc", "pag", "cfr", "ca", "cap", "vol"),
            "de", Set.of("z.b", "usw", "bzw", "dr", "nr", "s", "vgl", "ca", "ggf", "hr", "fr", "bd"),
            "nl", Set.of("dhr", "mevr", "bijv", "enz", "nr", "blz", "ca", "dr")
    );

    private static final Set<String> COMMON = Set.of("etc", "ca", "cf", "dr", "prof", "vol");

    @Override
    public List<Span> split(String text, String language) {
        List<Span> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        Set<String> abbr = ABBREVIATIONS.getOrDefault(lang(language), COMMON);
        Matcher m = BREAK.matcher(text);
        int start = 0;
        while (m.find()) {
            int end = m.end();
            if (end >= text.length()) break;
            if (!isBoundary(text, m.start(), end, abbr)) continue;
            out.add(new Span(start, end));
            start = end;
        }
        out.add(new Span(start, text.length()));
        return out;
    }

    private static boolean isBoundary(String text, int termAt, int next, Set<String> abbr) {
        char term = text.charAt(termAt);
        if (term != '.') return true;

        // next sentence must not start lowercase ("e.g. the", "p. 12")
        char following = text.charAt(next);
        if (Character.isLowerCase(following) || Character.isDigit(following)) return false;

        String token = tokenBefore(text, termAt);
        if (token.isEmpty()) return true;
        // initials: "P. Klee"
        if (token.length() == 1 && Character.isLetter(token.charAt(0))) return false;
        return !abbr.contains(token.toLowerCase(Locale.ROOT));
    }

    private static String tokenBefore(String text, int termAt) {
        int i = termAt;
        while (i > 0 && !Character.isWhitespace(text.charAt(i - 1))) i--;
        String token = text.substring(i, termAt);
        int k = 0;
        while (k < token.length() && !Character.isLetterOrDigit(token.charAt(k))) k++;
        return token.substring(k);
    }

    private static String lang(String language) {
        if (language == null) return "";
        String l = language.toLowerCase(Locale.ROOT);
        int dash = l.indexOf('-');
        return dash < 0 ? l : l.substring(0, dash);
    }
}
