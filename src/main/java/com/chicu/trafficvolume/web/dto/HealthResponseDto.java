package com.chicu.trafficvolume.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponseDto {

    @Schema(allowableValues = {"healthy", "unhealthy"})
    private String status;

    @JsonProperty("model_loaded")
    private boolean modelLoaded;

    /** ISO-8601 */
    private String timestamp;
}
