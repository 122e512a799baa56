package com.chicu.trafficvolume.web.dto;

import com.chicu.trafficvolume.model.PredictionResult;
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
public class PredictionResponseDto {

    @Schema(description = "Predicted traffic volume (vehicles/hour)", example = "3145")
    @JsonProperty("predicted_traffic_volume")
    private long predictedTrafficVolume;

    @Schema(description = "Model version used for prediction", example = "1.0.0")
    @JsonProperty("model_version")
    private String modelVersion;

    public static PredictionResponseDto of(PredictionResult result) {
        return PredictionResponseDto.builder()
                .predictedTrafficVolume(result.predictedTrafficVolume())
                .modelVersion(result.modelVersion())
                .build();
    }
}
