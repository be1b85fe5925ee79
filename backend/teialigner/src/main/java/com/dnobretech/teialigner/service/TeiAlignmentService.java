package com.dnobretech.teialigner.service;

import com.dnobretech.teialigner.align.AlignConfig;
import com.dnobretech.teialigner.compose.ComposedOutput;
import com.dnobretech.teialigner.dto.TeiAlignmentRequest;
import com.dnobretech.teialigner.dto.TeiAlignmentResponse;
import com.dnobretech.teialigner.tei.TeiDocument;

import java.util.Set;

public interface TeiAlignmentService {

    Set<String> SUPPORTED_LANGUAGES = Set.of(
            "ca", "zh", "cs", "da", "nl", "en", "fi", "fr", "de", "el", "hu", "is", "it",
            "lt", "lv", "no", "pl", "pt", "ro", "ru", "sk", "sl", "es", "sv", "tr");

    // parse, resolve languages, annotate and compose
    TeiAlignmentResponse align(TeiAlignmentRequest request);

    /**
     * Aligns two parsed documents and returns the composed corpus. Both trees are
     * annotated in place.
     *
     * @param mode "embedding" or "length"; null for the configured default
     */
    ComposedOutput annotate(TeiDocument source, TeiDocument target,
                            String sourceLanguage, String targetLanguage,
                            AlignConfig config, String mode);
}
