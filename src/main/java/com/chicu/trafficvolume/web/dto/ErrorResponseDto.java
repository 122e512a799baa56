package com.chicu.trafficvolume.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponseDto {

    @Schema(description = "Error kind", example = "validation_error")
    private String error;

    @Schema(description = "Detailed error information", example = "Invalid input data: clouds_all must be in [0, 100] (got 150)")
    private String detail;

    public static ErrorResponseDto of(String error, String detail) {
        return new ErrorResponseDto(error, detail);
    }
}
