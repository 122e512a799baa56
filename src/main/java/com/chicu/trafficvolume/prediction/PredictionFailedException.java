package com.chicu.trafficvolume.prediction;

import com.chicu.trafficvolume.common.error.ErrorKind;
import com.chicu.trafficvolume.common.error.TrafficApiException;

public class PredictionFailedException extends TrafficApiException {

    public PredictionFailedException(String message) {
        super(ErrorKind.PREDICTION_FAILED, message);
    }

    public PredictionFailedException(String message, Throwable cause) {
        super(ErrorKind.PREDICTION_FAILED, message, cause);
    }
}
