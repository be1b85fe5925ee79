package com.dnobretech.teialigner.annotate;

/**
 * How a unit is annotated: not at all, with one identifier for the whole unit,
 * or with a wrapper around each identified sentence.
 */
public enum UnitState {
    NONE,
    WHOLE,
    PARTIAL
}
