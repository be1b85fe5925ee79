package com.dnobretech.teialigner.align;

import java.util.List;

/**
 * Boundary to the bilingual aligner. Taken together the returned correspondences must
 * cover every source and every target index exactly once.
 */
public interface Aligner {
    List<Correspondence> align(List<String> source, List<String> target, AlignConfig config);
}
