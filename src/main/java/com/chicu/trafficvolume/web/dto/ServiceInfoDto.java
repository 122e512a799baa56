package com.chicu.trafficvolume.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceInfoDto {

    private String message;

    private String status;

    @JsonProperty("model_loaded")
    private boolean modelLoaded;

    private String version;

    @JsonProperty("docs_url")
    private String docsUrl;

    @Builder.Default
    private Map<String, String> endpoints = Map.of();
}
