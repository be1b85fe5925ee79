package com.dnobretech.teialigner.align;

import com.dnobretech.teialigner.tei.AlignableUnit;
import com.dnobretech.teialigner.tei.TeiDocument;

import java.util.List;

public record AlignmentSide(TeiDocument doc, List<AlignableUnit> units, String language) {

    public List<String> texts() {
        return units.stream().map(AlignableUnit::text).toList();
    }
}
