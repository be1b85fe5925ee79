package com.dnobretech.teialigner.tei;

import java.util.List;

/**
 * A paragraph- or heading-class element eligible for alignment.
 *
 * @param index   position in the document's unit sequence
 * @param address child-index path from the document node
 * @param tagName tag name as written in the source
 * @param text    normalized text, only ever fed to the aligner
 */
public record AlignableUnit(int index, List<Integer> address, String tagName, String text) {
}
