package com.dnobretech.teialigner.annotate;

import java.util.Map;
import java.util.Set;

/**
 * What the annotator inserted into one document.
 *
 * @param attributeIds identifiers added as an xml:id attribute on an existing element
 * @param wrapperIds   identifiers carried by inserted seg wrappers
 * @param states       final state per unit index; units not listed are NONE
 */
public record AnnotationResult(Set<String> attributeIds, Set<String> wrapperIds, Map<Integer, UnitState> states) {

    public AnnotationResult {
        attributeIds = Set.copyOf(attributeIds);
        wrapperIds = Set.copyOf(wrapperIds);
        states = Map.copyOf(states);
    }

    public UnitState stateOf(int unitIndex) {
        return states.getOrDefault(unitIndex, UnitState.NONE);
    }
}
