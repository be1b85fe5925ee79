package com.dnobretech.teialigner.dto;

import com.dnobretech.teialigner.align.AlignConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Body of POST /align/tei. Languages and aligner parameters are optional; missing
 * languages come from the TEI headers, missing parameters from {@link AlignConfig#defaults()}.
 */
public record TeiAlignmentRequest(
        @JsonProperty("source_tei") @NotBlank String sourceTei,
        @JsonProperty("target_tei") @NotBlank String targetTei,
        @JsonProperty("source_language") @Pattern(regexp = "^[a-z]{2}$", message = "must be a two-letter language code") String sourceLanguage,
        @JsonProperty("target_language") @Pattern(regexp = "^[a-z]{2}$", message = "must be a two-letter language code") String targetLanguage,
        @JsonProperty("max_align") @Min(1) @Max(10) Integer maxAlign,
        @JsonProperty("top_k") @Min(1) @Max(10) Integer topK,
        @Min(1) @Max(20) Integer win,
        @DecimalMin("-1.0") @DecimalMax("0.0") Double skip,
        Boolean margin,
        @JsonProperty("len_penalty") Boolean lenPenalty,
        @Pattern(regexp = "^(embedding|length)$", message = "must be 'embedding' or 'length'") String mode
) {

    public static TeiAlignmentRequest of(String sourceTei, String targetTei) {
        return new TeiAlignmentRequest(sourceTei, targetTei, null, null, null, null, null, null, null, null, null);
    }

    public AlignConfig toConfig() {
        AlignConfig d = AlignConfig.defaults();
        return new AlignConfig(
                maxAlign != null ? maxAlign : d.maxAlign(),
                topK != null ? topK : d.topK(),
                win != null ? win : d.win(),
                skip != null ? skip : d.skip(),
                margin != null ? margin : d.margin(),
                lenPenalty != null ? lenPenalty : d.lenPenalty()
        );
    }
}
