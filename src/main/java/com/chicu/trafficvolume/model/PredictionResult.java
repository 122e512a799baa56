package com.chicu.trafficvolume.model;

/**
 * @param predictedTrafficVolume vehicles per hour, never negative
 * @param modelVersion           version of the model that produced the estimate
 */
public record PredictionResult(long predictedTrafficVolume, String modelVersion) {

    public PredictionResult {
        if (predictedTrafficVolume < 0) {
            throw new IllegalArgumentException("predictedTrafficVolume < 0: " + predictedTrafficVolume);
        }
    }
}
