package com.chicu.trafficvolume.prediction;

import com.chicu.trafficvolume.common.error.ErrorKind;
import com.chicu.trafficvolume.common.error.TrafficApiException;

/**
 * The model was not loaded at startup. A deployment problem; retrying against this process does not help.
 */
public class ModelUnavailableException extends TrafficApiException {

    public ModelUnavailableException(String message) {
        super(ErrorKind.MODEL_UNAVAILABLE, message);
    }
}
