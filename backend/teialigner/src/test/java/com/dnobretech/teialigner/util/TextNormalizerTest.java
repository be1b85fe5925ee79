package com.dnobretech.teialigner.util;

import com.dnobretech.teialigner.util.TextNormalizer.NormalizedText;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer norm = new TextNormalizer();

    @Test
    void collapsesWhitespaceRunsAndTrims() {
        assertThat(norm.normalize("\n   Il  treno\tpartì\r\n presto.  ")).isEqualTo("Il treno partì presto.");
        assertThat(norm.normalize(null)).isEmpty();
        assertThat(norm.normalize(" \n\t ")).isEmpty();
    }

    @Test
    void mapsNormalizedOffsetsBackToRawText() {
        String raw = "  Uno.\n   Due.";
        NormalizedText nt = norm.normalizeWithOffsets(raw);

        assertThat(nt.text()).isEqualTo("Uno. Due.");
        // "Due." is normalized [5, 9)
        assertThat(raw.substring(nt.rawStart(5), nt.rawEnd(9))).isEqualTo("Due.");
        // the collapsed space points at the first whitespace of the run
        assertThat(nt.rawOffsets()[4]).isEqualTo(6);
        assertThat(raw.substring(nt.rawStart(0), nt.rawEnd(4))).isEqualTo("Uno.");
    }
}
