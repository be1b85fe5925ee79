package com.dnobretech.teialigner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TeiAlignmentResponse(
        @JsonProperty("aligned_xml") String alignedXml,
        @JsonProperty("source_language") String sourceLanguage,
        @JsonProperty("target_language") String targetLanguage,
        @JsonProperty("alignment_count") int alignmentCount,
        @JsonProperty("processing_time") double processingTime   // seconds
) {}
