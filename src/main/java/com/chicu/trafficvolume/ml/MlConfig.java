package com.chicu.trafficvolume.ml;

import com.chicu.trafficvolume.ml.features.FeatureSchema;
import com.chicu.trafficvolume.validation.ValidationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        ModelProperties.class,
        ValidationProperties.class
})
public class MlConfig {

    @Bean
    @ConditionalOnMissingBean
    public FeatureSchema featureSchema() {
        return FeatureSchema.canonical();
    }

    /**
     * Loaded exactly once while the context starts; every request path gets this same instance.
     */
    @Bean
    public ModelState modelState(PredictorLoader loader) {
        ModelState state = loader.load();
        if (!state.isLoaded()) {
            log.warn("⚠️ Starting without a model: /predict will answer model_unavailable ({})", state.reason());
        }
        return state;
    }
}
