package com.chicu.trafficvolume.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@Data
@ConfigurationProperties(prefix = "traffic.cors")
public class CorsProperties {

    private boolean enabled = true;

    /**
     * Allow-all by default. In production list the front-end origins explicitly.
     */
    private List<String> allowedOriginPatterns = List.of("*");

    private List<String> allowedMethods = List.of("GET", "POST", "OPTIONS");

    private List<String> allowedHeaders = List.of("*");

    private boolean allowCredentials = true;

    private long maxAge = 3600;
}
