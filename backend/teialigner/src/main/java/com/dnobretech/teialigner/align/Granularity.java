package com.dnobretech.teialigner.align;

public enum Granularity {
    /** whole alignable units */
    UNIT,
    /** sentence spans inside units */
    SENTENCE
}
