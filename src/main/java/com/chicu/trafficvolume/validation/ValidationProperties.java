package com.chicu.trafficvolume.validation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "traffic.validation")
public class ValidationProperties {

    /**
     * Derive an absent is_rush_hour from the hour instead of using the default (1).
     */
    private boolean deriveRushHour = false;
}
