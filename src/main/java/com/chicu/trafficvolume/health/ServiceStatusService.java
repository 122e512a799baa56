package com.chicu.trafficvolume.health;

import com.chicu.trafficvolume.ml.ModelProperties;
import com.chicu.trafficvolume.ml.ModelState;
import com.chicu.trafficvolume.web.dto.HealthResponseDto;
import com.chicu.trafficvolume.web.dto.ServiceInfoDto;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Readiness and info payloads. Reads the load flag only; never calls the model.
 */
@Service
@RequiredArgsConstructor
public class ServiceStatusService {

    public static final String SERVICE_NAME = "Metro Interstate Traffic Volume Prediction API";
    public static final String DOCS_URL = "/docs";

    private final ModelState modelState;
    private final ModelProperties props;
    private final Clock clock;

    public HealthResponseDto readiness() {
        boolean loaded = modelState.isLoaded();
        return HealthResponseDto.builder()
                .status(loaded ? "healthy" : "unhealthy")
                .modelLoaded(loaded)
                .timestamp(OffsetDateTime.now(clock).toString())
                .build();
    }

    public ServiceInfoDto info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("predict", "POST /predict - Make traffic volume prediction");
        endpoints.put("health", "GET /health - Readiness check");
        endpoints.put("info", "GET / - API information");
        endpoints.put("docs", "GET " + DOCS_URL + " - Interactive API documentation");

        return ServiceInfoDto.builder()
                .message(SERVICE_NAME)
                .status("running")
                .modelLoaded(modelState.isLoaded())
                .version(props.getVersion())
                .docsUrl(DOCS_URL)
                .endpoints(endpoints)
                .build();
    }
}
