package com.chicu.trafficvolume.ml;

import com.chicu.trafficvolume.ml.features.FeatureVector;

import java.util.List;

/**
 * A trained regression model. Loaded once, read-only afterwards, safe to share between threads.
 */
public interface Predictor {

    /** Raw estimate for one row. May be negative or fractional. */
    double predict(FeatureVector x) throws PredictorEvaluationException;

    /** Input names the model declares, in the model's own order. */
    List<String> inputNames();
}
