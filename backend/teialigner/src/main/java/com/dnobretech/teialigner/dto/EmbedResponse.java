package com.dnobretech.teialigner.dto;

import java.util.List;

// POST /embed { "texts": [...], "normalize": true } -> { "model": "...", "dims": 768, "vectors": [[...]] }
public record EmbedResponse(String model, int dims, List<double[]> vectors) {
}
