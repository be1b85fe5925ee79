package com.dnobretech.teialigner.segment;

import java.util.List;

/**
 * Language-aware sentence boundary detection over normalized text.
 * The returned spans are ordered and cover the whole input without gaps or overlap,
 * and the same input always yields the same spans.
 */
public interface SentenceSplitter {

    List<Span> split(String text, String language);

    // [start, end) in the normalized text; trailing whitespace belongs to the span
    record Span(int start, int end) {
    }
}
