package com.dnobretech.teialigner.util;

import org.springframework.stereotype.Component;

/**
 * Whitespace normalization used for everything handed to the aligner: runs of
 * whitespace (line breaks included) become a single space and the ends are trimmed.
 * The normalized form is never written back into a document.
 */
@Component
public class TextNormalizer {

    public String normalize(String s) {
        if (s == null) return "";
        return normalizeWithOffsets(s).text();
    }

    /**
     * Normalizes {@code raw} and records, for each normalized character, the index of
     * the raw character it came from. A collapsed whitespace run maps to its first character.
     */
    public NormalizedText normalizeWithOffsets(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        int[] map = new int[raw.length()];
        int n = 0;
        boolean pendingSpace = false;
        int pendingAt = -1;

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isWhitespace(c)) {
                if (!pendingSpace) {
                    pendingSpace = true;
                    pendingAt = i;
                }
                continue;
            }
            if (pendingSpace && n > 0) {
                sb.append(' ');
                map[n++] = pendingAt;
            }
            pendingSpace = false;
            sb.append(c);
            map[n++] = i;
        }

        int[] offsets = new int[n];
        System.arraycopy(map, 0, offsets, 0, n);
        return new NormalizedText(sb.toString(), offsets);
    }

    /**
     * @param text       normalized text
     * @param rawOffsets rawOffsets[i] is the raw index of text.charAt(i)
     */
    public record NormalizedText(String text, int[] rawOffsets) {

        public int rawStart(int normStart) {
            return rawOffsets[normStart];
        }

        // exclusive end in raw coordinates of a normalized range ending at normEnd (exclusive)
        public int rawEnd(int normEnd) {
            return rawOffsets[normEnd - 1] + 1;
        }
    }
}
