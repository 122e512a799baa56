package com.chicu.trafficvolume.prediction;

import com.chicu.trafficvolume.ml.ModelProperties;
import com.chicu.trafficvolume.ml.ModelState;
import com.chicu.trafficvolume.ml.Predictor;
import com.chicu.trafficvolume.ml.PredictorEvaluationException;
import com.chicu.trafficvolume.ml.features.FeatureSchema;
import com.chicu.trafficvolume.ml.features.FeatureVector;
import com.chicu.trafficvolume.model.FeatureRecord;
import com.chicu.trafficvolume.model.PredictionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one prediction: vector assembly, a single synchronous model call and coercion of the
 * raw estimate. Stateless; the shared {@link ModelState} is never modified here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    private final ModelState modelState;
    private final FeatureSchema schema;
    private final ModelProperties props;

    public PredictionResult predict(FeatureRecord record) {
        Predictor predictor = modelState.predictor().orElseThrow(() -> {
            log.error("🧠 Model not loaded: {}", modelState.reason());
            return new ModelUnavailableException("Model not loaded. Please check API server logs.");
        });

        log.info("🧠 Prediction request received: {}", record);

        double raw;
        try {
            FeatureVector x = schema.toVector(record);
            raw = predictor.predict(x);
        } catch (PredictorEvaluationException | RuntimeException e) {
            log.error("🧠 Prediction error: {}", e.toString());
            throw new PredictionFailedException("An error occurred during prediction: " + safeMsg(e), e);
        }

        if (!Double.isFinite(raw)) {
            log.error("🧠 Prediction error: model returned {}", raw);
            throw new PredictionFailedException("An error occurred during prediction: model returned a non-finite value (" + raw + ")");
        }

        long volume = toVolume(raw);
        log.info("🧠 Prediction successful: {} (raw={})", volume, raw);

        return new PredictionResult(volume, props.getVersion());
    }

    /**
     * Truncates toward zero, then clamps to zero: traffic volume cannot be negative.
     */
    static long toVolume(double raw) {
        long truncated = (long) raw;
        return Math.max(0L, truncated);
    }

    private static String safeMsg(Throwable e) {
        String m = e.getMessage();
        return (m != null && !m.isBlank()) ? m : e.getClass().getSimpleName();
    }
}
