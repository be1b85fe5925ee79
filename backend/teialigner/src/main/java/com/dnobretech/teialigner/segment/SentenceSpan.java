package com.dnobretech.teialigner.segment;

/**
 * One sentence of a unit, located both in the normalized text and in the unit's raw text.
 *
 * @param index    position among the unit's sentences
 * @param start    start in the unit's normalized text
 * @param end      exclusive end in the unit's normalized text
 * @param rawStart start in the concatenated raw text of the unit element
 * @param rawEnd   exclusive end in the raw text
 * @param text     normalized sentence text, as handed to the aligner
 */
public record SentenceSpan(int index, int start, int end, int rawStart, int rawEnd, String text) {
}
