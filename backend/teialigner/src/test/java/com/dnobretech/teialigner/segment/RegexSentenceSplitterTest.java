package com.dnobretech.teialigner.segment;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegexSentenceSplitterTest {

    private final RegexSentenceSplitter splitter = new RegexSentenceSplitter();

    private List<String> sentences(String text, String lang) {
        return splitter.split(text, lang).stream()
                .map(s -> text.substring(s.start(), s.end()).trim())
                .toList();
    }

    @Test
    void splitsOnTerminatorsFollowedByWhitespace() {
        assertThat(sentences("Il treno partì. Nessuno lo salutò! Perché? Fine.", "it"))
                .containsExactly("Il treno partì.", "Nessuno lo salutò!", "Perché?", "Fine.");
    }

    @Test
    void spansCoverTheWholeTextWithoutGaps() {
        String text = "One.  Two. Three";
        List<SentenceSplitter.Span> spans = splitter.split(text, "en");

        assertThat(spans.get(0).start()).isZero();
        assertThat(spans.get(spans.size() - 1).end()).isEqualTo(text.length());
        for (int i = 1; i < spans.size(); i++) {
            assertThat(spans.get(i).start()).isEqualTo(spans.get(i - 1).end());
        }
    }

    @Test
    void keepsAbbreviationsInitialsAndLowercaseContinuations() {
        assertThat(sentences("Dr. Smith met P. Klee. They talked, e.g. about art.", "en"))
                .containsExactly("Dr. Smith met P. Klee.", "They talked, e.g. about art.");
        assertThat(sentences("Il sig. Rossi arrivò. Poi partì.", "it"))
                .containsExactly("Il sig. Rossi arrivò.", "Poi partì.");
    }

    @Test
    void splitsCjkWithoutWhitespace() {
        assertThat(sentences("我们走了。他留下了！", "zh")).containsExactly("我们走了。", "他留下了！");
    }

    @Test
    void closingQuotesStayWithTheirSentence() {
        assertThat(sentences("He said \"Go.\" She went.", "en"))
                .containsExactly("He said \"Go.\"", "She went.");
    }

    @Test
    void isDeterministic() {
        String text = "A first one. A second one. A third one.";
        assertThat(splitter.split(text, "en")).isEqualTo(splitter.split(text, "en"));
    }

    @Test
    void emptyTextHasNoSpans() {
        assertThat(splitter.split("", "en")).isEmpty();
    }
}
