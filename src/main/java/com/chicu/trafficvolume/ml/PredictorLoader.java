package com.chicu.trafficvolume.ml;

import com.chicu.trafficvolume.ml.features.FeatureSchema;
import com.chicu.trafficvolume.ml.pmml.PmmlPredictor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;

/**
 * Loads the trained pipeline once. A missing or broken artifact leaves the service running
 * with an unloaded model instead of failing startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredictorLoader {

    private final ResourceLoader resourceLoader;
    private final ModelProperties props;
    private final FeatureSchema schema;
    private final Clock clock;

    public ModelState load() {
        String location = props.getArtifactLocation();
        if (location == null || location.isBlank()) {
            log.error("❌ traffic.model.artifact-location is not set, model NOT loaded");
            return ModelState.unloaded(location, "model artifact location is not configured");
        }

        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            log.error("❌ Model file '{}' not found. Run the training notebook first and export the pipeline to PMML.", location);
            return ModelState.unloaded(location, "model artifact not found: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            PmmlPredictor predictor = PmmlPredictor.load(in, location);
            warnOnSchemaMismatch(predictor.inputNames());
            log.info("✅ Model pipeline loaded from {} inputs={} target={}",
                    location, predictor.inputNames(), predictor.targetName());
            return ModelState.loaded(predictor, location, clock.instant());
        } catch (PredictorLoadException | IOException e) {
            log.error("❌ Model pipeline NOT loaded from {}: {}", location, e.getMessage(), e);
            return ModelState.unloaded(location, e.getMessage());
        }
    }

    private void warnOnSchemaMismatch(List<String> modelInputs) {
        List<String> missing = modelInputs.stream()
                .filter(n -> !schema.featureNames().contains(n))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("⚠️ Model expects inputs the request schema does not provide: {} (they will be passed as missing)", missing);
        }
    }
}
