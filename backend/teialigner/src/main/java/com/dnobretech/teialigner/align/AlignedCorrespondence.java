package com.dnobretech.teialigner.align;

import java.util.List;

/**
 * A retained, two-sided correspondence resolved to units and sentence spans.
 */
public record AlignedCorrespondence(List<Participant> source,
                                    List<Participant> target,
                                    double score,
                                    Granularity granularity) {

    public AlignedCorrespondence {
        source = List.copyOf(source);
        target = List.copyOf(target);
    }
}
