package com.dnobretech.teialigner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        String status,
        String version,
        @JsonProperty("model_loaded") boolean modelLoaded
) {}
