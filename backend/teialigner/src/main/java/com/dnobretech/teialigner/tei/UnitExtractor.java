package com.dnobretech.teialigner.tei;

import com.dnobretech.teialigner.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a TEI tree in document order and yields its alignable units.
 */
@Slf4j
@Component
public class UnitExtractor {

    private final Set<String> unitTags;
    private final String scope;
    private final TextNormalizer norm;

    public UnitExtractor(@Value("${teialigner.units.tags:p,head}") List<String> unitTags,
                         @Value("${teialigner.units.scope:body}") String scope,
                         TextNormalizer norm) {
        this.unitTags = new LinkedHashSet<>(unitTags);
        this.scope = scope == null ? "" : scope.trim();
        this.norm = norm;
    }

    public List<AlignableUnit> extract(TeiDocument doc) {
        List<AlignableUnit> out = new ArrayList<>();
        int skipped = 0;

        for (Element el : doc.document().getAllElements()) {
            if (!unitTags.contains(TeiMarkup.localName(el.tagName()))) continue;
            if (!inScope(el)) continue;

            String text = norm.normalize(UnitText.rawText(el));
            if (text.isEmpty()) {
                skipped++;
                continue;
            }
            out.add(new AlignableUnit(out.size(), TreeAddress.of(el), el.tagName(), text));
        }

        log.debug("UnitExtractor: {} units, {} empty skipped (tags={}, scope={})",
                out.size(), skipped, unitTags, scope.isEmpty() ? "<document>" : scope);
        return out;
    }

    private boolean inScope(Element el) {
        if (scope.isEmpty()) return true;
        for (Element p = el.parent(); p != null; p = p.parent()) {
            if (scope.equals(TeiMarkup.localName(p.tagName()))) return true;
        }
        return false;
    }
}
