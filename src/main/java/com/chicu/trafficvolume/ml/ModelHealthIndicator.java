package com.chicu.trafficvolume.ml;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Publishes the model load state as the actuator health component "model".
 */
@Component("model")
@RequiredArgsConstructor
public class ModelHealthIndicator implements HealthIndicator {

    private final ModelState state;
    private final ModelProperties props;

    @Override
    public Health health() {
        if (!state.isLoaded()) {
            return Health.down()
                    .withDetail("artifact", String.valueOf(state.artifact()))
                    .withDetail("reason", String.valueOf(state.reason()))
                    .build();
        }
        return Health.up()
                .withDetail("artifact", state.artifact())
                .withDetail("version", props.getVersion())
                .withDetail("loadedAt", state.loadedAt().map(Object::toString).orElse("?"))
                .build();
    }
}
