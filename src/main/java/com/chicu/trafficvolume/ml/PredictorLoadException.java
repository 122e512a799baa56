package com.chicu.trafficvolume.ml;

public class PredictorLoadException extends Exception {

    public PredictorLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
