package com.dnobretech.teialigner.annotate;

import com.dnobretech.teialigner.tei.TeiMarkup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Undoes exactly what {@link TreeAnnotator} inserted: the listed xml:id attributes are
 * removed and the listed seg wrappers are replaced by their content. Text nodes split
 * by the annotator stay split; they serialize as before.
 */
@Component
public class AnnotationStripper {

    public void strip(Document doc, AnnotationResult result) {
        List<Element> wrappers = new ArrayList<>();
        for (Element el : doc.getAllElements()) {
            if (!el.hasAttr(TeiMarkup.ID_ATTR)) continue;
            String id = el.attr(TeiMarkup.ID_ATTR);
            if (result.attributeIds().contains(id)) {
                el.removeAttr(TeiMarkup.ID_ATTR);
            } else if (result.wrapperIds().contains(id) && TeiMarkup.SEG.equals(TeiMarkup.localName(el.tagName()))) {
                wrappers.add(el);
            }
        }
        for (Element seg : wrappers) seg.unwrap();
    }
}
