package com.dnobretech.teialigner.align;

import com.dnobretech.teialigner.segment.SentenceSpan;
import com.dnobretech.teialigner.tei.AlignableUnit;

/**
 * One unit, or one sentence of a unit, taking part in a correspondence.
 * A null span means the whole unit.
 */
public record Participant(Side side, AlignableUnit unit, SentenceSpan span) {

    public static Participant whole(Side side, AlignableUnit unit) {
        return new Participant(side, unit, null);
    }

    public boolean isWholeUnit() {
        return span == null;
    }

    public String text() {
        return span == null ? unit.text() : span.text();
    }
}
