package com.chicu.trafficvolume.web.controller.api;

import com.chicu.trafficvolume.model.FeatureRecord;
import com.chicu.trafficvolume.prediction.PredictionService;
import com.chicu.trafficvolume.validation.FeatureRecordValidator;
import com.chicu.trafficvolume.web.dto.ErrorResponseDto;
import com.chicu.trafficvolume.web.dto.PredictionResponseDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Prediction endpoint. Validation happens before any model call.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "prediction")
public class PredictionApiController {

    private final FeatureRecordValidator validator;
    private final PredictionService predictionService;

    @Operation(
            summary = "Predict hourly traffic volume",
            description = "Absent fields take their defaults: holiday=None, temp=288.28, rain_1h=0, snow_1h=0, "
                    + "clouds_all=40, weather_main=Clouds, hour=9, day_of_week=1, month=10, is_rush_hour=1"
    )
    @ApiResponse(responseCode = "200", description = "Prediction")
    @ApiResponse(responseCode = "400", description = "Bad Request",
            content = @Content(schema = @Schema(implementation = ErrorResponseDto.class)))
    @ApiResponse(responseCode = "500", description = "Model not loaded or prediction failed",
            content = @Content(schema = @Schema(implementation = ErrorResponseDto.class)))
    @PostMapping("/predict")
    public PredictionResponseDto predict(@RequestBody(required = false) Map<String, Object> body) {
        FeatureRecord record = validator.validate(body);
        return PredictionResponseDto.of(predictionService.predict(record));
    }
}
