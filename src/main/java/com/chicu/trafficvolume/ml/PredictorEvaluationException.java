package com.chicu.trafficvolume.ml;

public class PredictorEvaluationException extends Exception {

    public PredictorEvaluationException(String message) {
        super(message);
    }

    public PredictorEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
