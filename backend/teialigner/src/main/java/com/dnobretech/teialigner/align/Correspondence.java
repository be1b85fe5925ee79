package com.dnobretech.teialigner.align;

import java.util.List;

/**
 * One aligner result: items on each side that translate each other. Either side may be
 * empty when the aligner found no counterpart.
 */
public record Correspondence(List<Integer> sourceIndices,
                             List<Integer> targetIndices,
                             double score) {

    public Correspondence {
        sourceIndices = List.copyOf(sourceIndices);
        targetIndices = List.copyOf(targetIndices);
    }

    public static Correspondence of(List<Integer> src, List<Integer> tgt, double score) {
        return new Correspondence(src, tgt, score);
    }

    public boolean isOneSided() {
        return sourceIndices.isEmpty() || targetIndices.isEmpty();
    }
}
