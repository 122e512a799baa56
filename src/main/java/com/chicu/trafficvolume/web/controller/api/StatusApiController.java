package com.chicu.trafficvolume.web.controller.api;

import com.chicu.trafficvolume.health.ServiceStatusService;
import com.chicu.trafficvolume.web.dto.HealthResponseDto;
import com.chicu.trafficvolume.web.dto.ServiceInfoDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "status")
public class StatusApiController {

    private final ServiceStatusService statusService;

    @Operation(summary = "API information")
    @GetMapping("/")
    public ServiceInfoDto info() {
        return statusService.info();
    }

    @Operation(summary = "Readiness: is the model loaded")
    @GetMapping("/health")
    public HealthResponseDto health() {
        return statusService.readiness();
    }
}
